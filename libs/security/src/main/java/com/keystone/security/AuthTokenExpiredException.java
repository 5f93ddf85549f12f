package com.keystone.security;

import java.time.Instant;

/** The token is otherwise valid but its {@code exp} lies outside the clock tolerance. */
public class AuthTokenExpiredException extends KeystoneException {

    private final Instant expiredAt;

    public AuthTokenExpiredException(Instant expiredAt) {
        super(ErrorCode.TOKEN_EXPIRED, "Token has expired");
        this.expiredAt = expiredAt;
    }

    public Instant expiredAt() {
        return expiredAt;
    }
}
