package com.keystone.security;

public class ConflictException extends KeystoneException {

    public ConflictException(String message) {
        super(ErrorCode.CONFLICT, message);
    }
}
