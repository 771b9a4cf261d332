package com.chanakya.littleyears.access;

/**
 * Outcome of a timeline access check.
 *
 * @param query           scope actually sent to storage
 * @param includesPrivate whether private moments are included, regardless of what was requested
 */
public record AccessDecision(
        MomentQuery query,
        boolean includesPrivate
) {
    public static AccessDecision publicOnly(String kidId) {
        return new AccessDecision(new MomentQuery.ByKidPublicOnly(kidId), false);
    }

    public static AccessDecision withPrivate(String kidId) {
        return new AccessDecision(new MomentQuery.ByKid(kidId), true);
    }
}
