package com.keystone.security;

/**
 * The signing key set could not be fetched and no previously cached keys exist. Callers may retry
 * after a backoff.
 */
public class KeyProviderUnavailableException extends KeystoneException {

    public KeyProviderUnavailableException(String message, Throwable cause) {
        super(ErrorCode.KEY_PROVIDER_UNAVAILABLE, message, cause);
    }
}
