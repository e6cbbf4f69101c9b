package com.dealengine.security;

import java.util.Collection;
import java.util.EnumSet;
import java.util.Set;

/**
 * Pure permission predicates over {@link Role} and {@link PrincipalBinding}.
 *
 * Performs no authentication and no I/O.
 */
public final class PermissionPolicy {

    private PermissionPolicy() {
    }

    public static boolean hasPermission(Role role, Permission permission) {
        return role != null && permission != null && role.getPermissions().contains(permission);
    }

    /**
     * Role defaults unioned with the principal's explicit grants.
     */
    public static Set<Permission> effectivePermissions(PrincipalBinding principal) {
        EnumSet<Permission> effective = EnumSet.noneOf(Permission.class);
        if (principal == null) {
            return effective;
        }
        if (principal.getRole() != null) {
            effective.addAll(principal.getRole().getPermissions());
        }
        if (principal.getExplicitPermissions() != null) {
            effective.addAll(principal.getExplicitPermissions());
        }
        return effective;
    }

    public static boolean userHasPermission(PrincipalBinding principal, Permission permission) {
        return permission != null && effectivePermissions(principal).contains(permission);
    }

    public static boolean userHasAnyPermission(PrincipalBinding principal, Collection<Permission> permissions) {
        Set<Permission> effective = effectivePermissions(principal);
        return permissions.stream().anyMatch(effective::contains);
    }

    public static boolean hasRoleLevel(Role role, Role required) {
        return role != null && required != null && role.isAtLeast(required);
    }
}
