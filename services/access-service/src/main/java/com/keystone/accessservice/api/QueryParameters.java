package com.keystone.accessservice.api;

import com.keystone.security.ValidationException;
import java.util.function.Function;

/** Conversion of optional query parameters; a value the parser rejects is a client error. */
final class QueryParameters {

    private QueryParameters() {
    }

    /**
     * @return the parsed value, or {@code null} when the parameter is absent
     * @throws ValidationException if {@code parser} rejects the value
     */
    static <T> T optional(String name, String value, Function<String, T> parser) {
        if (value == null) {
            return null;
        }
        try {
            return parser.apply(value);
        } catch (IllegalArgumentException e) {
            throw new ValidationException("Invalid " + name + " '" + value + "'");
        }
    }
}
