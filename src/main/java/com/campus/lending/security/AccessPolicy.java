package com.campus.lending.security;

import com.campus.lending.exception.InsufficientPrivilegeException;

/**
 * Authorization checks shared by all services. Every check runs before the calling
 * service touches a repository for writing.
 */
public final class AccessPolicy {

    private AccessPolicy() {}

    /**
     * @param action human-readable description used in the 403 message, e.g. "create loans"
     */
    public static void requireStaff(Actor actor, String action) {
        if (!actor.isStaff()) {
            throw new InsufficientPrivilegeException("Only staff may " + action);
        }
    }

    public static void requireSystemAdmin(Actor actor, String action) {
        if (!actor.isSystemAdmin()) {
            throw new InsufficientPrivilegeException("Only a system administrator may " + action);
        }
    }

    public static void requireOwnerOrStaff(Actor actor, Long ownerId, String resource) {
        if (!actor.isStaff() && !actor.is(ownerId)) {
            throw new InsufficientPrivilegeException("You are not allowed to view this " + resource);
        }
    }
}
