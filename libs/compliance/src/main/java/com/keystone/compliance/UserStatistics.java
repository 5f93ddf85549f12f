package com.keystone.compliance;

/**
 * Counts over non-deleted users of one scope.
 *
 * @param verificationRate percentage of users with a verified email, 0 when there are no users
 */
public record UserStatistics(
        long totalUsers, long activeUsers, long blockedUsers, long emailVerifiedUsers, double verificationRate) {

    public static UserStatistics of(long total, long active, long blocked, long emailVerified) {
        double rate = total > 0 ? (double) emailVerified / total * 100 : 0;
        return new UserStatistics(total, active, blocked, emailVerified, rate);
    }

    public static UserStatistics empty() {
        return of(0, 0, 0, 0);
    }
}
