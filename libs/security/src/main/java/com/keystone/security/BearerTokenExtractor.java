package com.keystone.security;

import java.util.Locale;
import java.util.Optional;

/** Extracts the token from an {@code Authorization: Bearer <token>} header value. */
public final class BearerTokenExtractor {

    private static final String PREFIX = "bearer ";

    private BearerTokenExtractor() {
        // utility class
    }

    /**
     * @param authorizationHeader the full header value (may be null)
     * @return the token, or empty if the header is missing, uses another scheme or has no token
     */
    public static Optional<String> extract(String authorizationHeader) {
        if (authorizationHeader == null || authorizationHeader.isBlank()) {
            return Optional.empty();
        }
        String trimmed = authorizationHeader.strip();
        if (!trimmed.toLowerCase(Locale.ROOT).startsWith(PREFIX)) {
            return Optional.empty();
        }
        String token = trimmed.substring(PREFIX.length()).strip();
        return token.isEmpty() ? Optional.empty() : Optional.of(token);
    }
}
