package com.keystone.security;

/**
 * Stable machine-readable error codes exposed to API callers.
 *
 * <p>The code strings are part of the public contract and must never change once released. The
 * HTTP status is the conventional affinity; the web layer decides the final response.
 */
public enum ErrorCode {
    UNAUTHORIZED("AUTH_1001", 401),
    FORBIDDEN("AUTH_1002", 403),
    TOKEN_EXPIRED("AUTH_1003", 401),
    INVALID_TOKEN("AUTH_1004", 401),
    VALIDATION_ERROR("VAL_2001", 400),
    TENANT_REQUIRED("VAL_2003", 400),
    NOT_FOUND("RES_3001", 404),
    CONFLICT("RES_3003", 409),
    CROSS_ORG_ACCESS("BIZ_4004", 403),
    KEY_PROVIDER_UNAVAILABLE("EXT_5003", 503),
    INTERNAL_ERROR("SRV_9001", 500);

    private final String code;
    private final int httpStatus;

    ErrorCode(String code, int httpStatus) {
        this.code = code;
        this.httpStatus = httpStatus;
    }

    public String code() {
        return code;
    }

    public int httpStatus() {
        return httpStatus;
    }
}
