package com.keystone.security;

/** The operation needs an organization context but none could be resolved for the caller. */
public class TenantRequiredException extends KeystoneException {

    public TenantRequiredException(String message) {
        super(ErrorCode.TENANT_REQUIRED, message);
    }
}
