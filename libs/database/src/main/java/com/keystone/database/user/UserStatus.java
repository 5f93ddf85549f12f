package com.keystone.database.user;

import com.keystone.database.StorageCodes;

/** Lifecycle status of a stored user account. */
public enum UserStatus {
    ACTIVE,
    INACTIVE,
    BLOCKED,
    PENDING;

    public static final StorageCodes<UserStatus> CODES = StorageCodes.builder(UserStatus.class, 1)
            .map(ACTIVE, "active")
            .map(INACTIVE, "inactive")
            .map(BLOCKED, "blocked")
            .map(PENDING, "pending")
            .build();
}
