package com.keystone.database;

import java.util.Collections;
import java.util.EnumMap;
import java.util.HashMap;
import java.util.Map;

/**
 * Explicit mapping between an enum and the string codes stored for it.
 *
 * <p>Codes are part of the stored data, not of the Java type: renaming a constant must not change
 * its code. Every constant must be mapped exactly once; retired codes may be kept as decode-only
 * aliases. The version is bumped whenever a code is added, retired or aliased.
 *
 * @param <E> the mapped enum
 */
public final class StorageCodes<E extends Enum<E>> {

    private final Class<E> type;
    private final int version;
    private final Map<E, String> codes;
    private final Map<String, E> values;

    private StorageCodes(Class<E> type, int version, Map<E, String> codes, Map<String, E> values) {
        this.type = type;
        this.version = version;
        this.codes = Collections.unmodifiableMap(codes);
        this.values = Collections.unmodifiableMap(values);
    }

    public static <E extends Enum<E>> Builder<E> builder(Class<E> type, int version) {
        return new Builder<>(type, version);
    }

    /** The stored code for {@code value}, or null for null. */
    public String encode(E value) {
        return value == null ? null : codes.get(value);
    }

    /**
     * The constant for a stored code, or null for null.
     *
     * @throws IllegalStateException if the code is not known to this mapping
     */
    public E decode(String code) {
        if (code == null) {
            return null;
        }
        E value = values.get(code);
        if (value == null) {
            throw new IllegalStateException(
                    "Unknown stored code '" + code + "' for " + type.getSimpleName() + " (mapping v" + version + ")");
        }
        return value;
    }

    public int version() {
        return version;
    }

    public Class<E> type() {
        return type;
    }

    public static final class Builder<E extends Enum<E>> {

        private final Class<E> type;
        private final int version;
        private final Map<E, String> codes;
        private final Map<String, E> values = new HashMap<>();

        private Builder(Class<E> type, int version) {
            this.type = type;
            this.version = version;
            this.codes = new EnumMap<>(type);
        }

        public Builder<E> map(E value, String code) {
            if (codes.containsKey(value)) {
                throw new IllegalArgumentException(value + " is already mapped");
            }
            register(code, value);
            codes.put(value, code);
            return this;
        }

        /** A retired code that still decodes to {@code value}. */
        public Builder<E> alias(String legacyCode, E value) {
            register(legacyCode, value);
            return this;
        }

        public StorageCodes<E> build() {
            for (E constant : type.getEnumConstants()) {
                if (!codes.containsKey(constant)) {
                    throw new IllegalStateException(
                            type.getSimpleName() + "." + constant.name() + " has no storage code");
                }
            }
            return new StorageCodes<>(type, version, codes, values);
        }

        private void register(String code, E value) {
            if (code == null || code.isBlank()) {
                throw new IllegalArgumentException("code must not be blank");
            }
            E existing = values.putIfAbsent(code, value);
            if (existing != null) {
                throw new IllegalArgumentException("Code '" + code + "' is already used by " + existing);
            }
        }
    }
}
