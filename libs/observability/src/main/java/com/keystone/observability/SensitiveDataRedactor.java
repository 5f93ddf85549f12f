package com.keystone.observability;

import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Redacts values of secret-looking keys from structured payloads before they are logged or
 * persisted in the audit trail.
 *
 * <p>Matching is case-insensitive and substring based ({@code "X-Api-Key"} matches {@code apikey}
 * after separators are stripped). Nested maps and lists are walked recursively; the input is never
 * modified.
 */
public final class SensitiveDataRedactor {

    public static final String REDACTED = "[REDACTED]";

    private static final Set<String> DEFAULT_PATTERNS = Set.of(
            "password", "token", "secret", "authorization", "apikey", "credential", "privatekey");

    private static final Pattern SEPARATORS = Pattern.compile("[-_.\\s]");

    private final Pattern compiled;

    public SensitiveDataRedactor() {
        this(DEFAULT_PATTERNS);
    }

    /**
     * @param patterns lower-case key fragments considered sensitive
     */
    public SensitiveDataRedactor(Set<String> patterns) {
        if (patterns == null || patterns.isEmpty()) {
            throw new IllegalArgumentException("patterns must not be null or empty");
        }
        String regex = String.join("|", patterns.stream().map(Pattern::quote).toList());
        this.compiled = Pattern.compile(regex, Pattern.CASE_INSENSITIVE);
    }

    /**
     * Returns a deep copy of {@code data} with sensitive values replaced by {@value #REDACTED}.
     * Null input yields an empty map.
     */
    public Map<String, Object> redact(Map<String, ?> data) {
        if (data == null || data.isEmpty()) {
            return Map.of();
        }
        Map<String, Object> result = new LinkedHashMap<>(data.size());
        data.forEach((key, value) -> result.put(key, isSensitive(key) ? REDACTED : redactValue(value)));
        return result;
    }

    /** Checks whether a key names a sensitive value. */
    public boolean isSensitive(String key) {
        if (key == null) {
            return false;
        }
        return compiled.matcher(SEPARATORS.matcher(key).replaceAll("")).find();
    }

    @SuppressWarnings("unchecked")
    private Object redactValue(Object value) {
        if (value instanceof Map<?, ?> nested) {
            Map<String, Object> copy = new LinkedHashMap<>();
            nested.forEach((k, v) -> {
                String key = String.valueOf(k);
                copy.put(key, isSensitive(key) ? REDACTED : redactValue(v));
            });
            return copy;
        }
        if (value instanceof Collection<?> items) {
            List<Object> copy = new ArrayList<>(items.size());
            items.forEach(item -> copy.add(redactValue(item)));
            return copy;
        }
        return value;
    }
}
