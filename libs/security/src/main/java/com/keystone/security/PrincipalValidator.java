package com.keystone.security;

import java.util.ArrayList;
import java.util.List;

/**
 * Checks that an extracted {@link Principal} is usable where an identity is required.
 *
 * <p>Extraction itself accepts a missing subject; this validator is where such principals are
 * rejected. Collects every problem instead of failing on the first.
 */
public final class PrincipalValidator {

    private PrincipalValidator() {
        // utility class
    }

    public static ValidationResult validate(Principal principal) {
        return validate(principal, false);
    }

    /**
     * @param requireVerifiedEmail also require a verified email address
     */
    public static ValidationResult validate(Principal principal, boolean requireVerifiedEmail) {
        if (principal == null) {
            return ValidationResult.fail(List.of("principal must not be null"));
        }
        List<String> errors = new ArrayList<>();
        if (principal.subjectId().isBlank()) {
            errors.add("subjectId must not be blank");
        }
        if (principal.rawToken() == null || principal.rawToken().isBlank()) {
            errors.add("rawToken must not be blank");
        }
        if (requireVerifiedEmail && !principal.emailVerified()) {
            errors.add("email must be verified");
        }
        return errors.isEmpty() ? ValidationResult.ok() : ValidationResult.fail(errors);
    }
}
