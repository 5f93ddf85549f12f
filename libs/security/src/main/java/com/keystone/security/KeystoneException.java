package com.keystone.security;

/**
 * Root of the platform's typed failures. Every subclass carries a stable {@link ErrorCode} so the
 * web layer can render a problem response without inspecting exception types.
 */
public abstract class KeystoneException extends RuntimeException {

    private final ErrorCode errorCode;

    protected KeystoneException(ErrorCode errorCode, String message) {
        super(message);
        this.errorCode = errorCode;
    }

    protected KeystoneException(ErrorCode errorCode, String message, Throwable cause) {
        super(message, cause);
        this.errorCode = errorCode;
    }

    public ErrorCode errorCode() {
        return errorCode;
    }
}
