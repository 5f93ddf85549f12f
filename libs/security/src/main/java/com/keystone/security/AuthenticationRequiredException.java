package com.keystone.security;

/** No usable credentials were presented, or the token did not identify a subject. */
public class AuthenticationRequiredException extends KeystoneException {

    public AuthenticationRequiredException(String message) {
        super(ErrorCode.UNAUTHORIZED, message);
    }
}
