package com.keystone.security;

/**
 * The bearer token is malformed, uses a disallowed algorithm, has a bad signature, references an
 * unknown key or carries unacceptable claims. Not retryable without a new token.
 */
public class AuthTokenInvalidException extends KeystoneException {

    public AuthTokenInvalidException(String message) {
        super(ErrorCode.INVALID_TOKEN, message);
    }

    public AuthTokenInvalidException(String message, Throwable cause) {
        super(ErrorCode.INVALID_TOKEN, message, cause);
    }
}
