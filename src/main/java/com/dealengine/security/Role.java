package com.dealengine.security;

import java.util.Collections;
import java.util.EnumSet;
import java.util.Locale;
import java.util.Set;

/**
 * Ranked roles. Each role holds every permission of the role below it plus its own
 * additions, so permission sets grow strictly with rank:
 * USER < REVIEWER < ADMIN < SYSTEM.
 */
public enum Role {
    USER(1, null,
        Permission.READ_PROMOTIONS),

    REVIEWER(2, USER,
        Permission.READ_EVIDENCE,
        Permission.REVIEW_VALIDATION,
        Permission.VIEW_LOGS,
        Permission.VIEW_ADMIN),

    ADMIN(3, REVIEWER,
        Permission.WRITE_PROMOTIONS,
        Permission.APPROVE_PROMOTIONS,
        Permission.WRITE_EVIDENCE,
        Permission.VALIDATE_PROMOTION,
        Permission.OVERRIDE_VALIDATION,
        Permission.MANAGE_USERS,
        Permission.MANAGE_ADMIN),

    SYSTEM(4, ADMIN,
        Permission.DELETE_EVIDENCE,
        Permission.MANAGE_SYSTEM);

    private final int rank;
    private final Set<Permission> permissions;

    Role(int rank, Role inherits, Permission... additions) {
        this.rank = rank;
        EnumSet<Permission> granted = inherits == null
            ? EnumSet.noneOf(Permission.class)
            : EnumSet.copyOf(inherits.permissions);
        Collections.addAll(granted, additions);
        this.permissions = Collections.unmodifiableSet(granted);
    }

    public int getRank() {
        return rank;
    }

    public Set<Permission> getPermissions() {
        return permissions;
    }

    public boolean isAtLeast(Role required) {
        return rank >= required.rank;
    }

    public static Role fromString(String value) {
        if (value == null || value.isBlank()) {
            return USER;
        }
        return Role.valueOf(value.trim().toUpperCase(Locale.ROOT));
    }
}
