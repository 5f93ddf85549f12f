package com.keystone.security;

import java.util.List;

/**
 * Outcome of a structural validation: either valid (no errors) or invalid with messages.
 *
 * @param valid  whether all checks passed
 * @param errors validation messages (empty if valid)
 */
public record ValidationResult(boolean valid, List<String> errors) {

    public static ValidationResult ok() {
        return new ValidationResult(true, List.of());
    }

    public static ValidationResult fail(List<String> errors) {
        return new ValidationResult(false, List.copyOf(errors));
    }
}
