package com.keystone.security;

/** Request input that is well-formed but semantically invalid. */
public class ValidationException extends KeystoneException {

    public ValidationException(String message) {
        super(ErrorCode.VALIDATION_ERROR, message);
    }
}
