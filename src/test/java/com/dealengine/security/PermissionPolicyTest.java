package com.dealengine.security;

import com.dealengine.common.exception.PermissionDeniedException;
import org.junit.jupiter.api.Test;

import java.util.EnumSet;
import java.util.List;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Unit tests for PermissionPolicy and AccessGuard.
 */
class PermissionPolicyTest {

    private final AccessGuard accessGuard = new AccessGuard();

    @Test
    void testExplicitPermissionsAreUnionedWithRole() {
        PrincipalBinding reviewer = new PrincipalBinding("rev-1", Role.REVIEWER, EnumSet.of(Permission.WRITE_EVIDENCE));

        Set<Permission> effective = PermissionPolicy.effectivePermissions(reviewer);

        assertTrue(effective.containsAll(Role.REVIEWER.getPermissions()));
        assertTrue(effective.contains(Permission.WRITE_EVIDENCE));
        assertFalse(effective.contains(Permission.OVERRIDE_VALIDATION));
    }

    @Test
    void testExplicitPermissionsNeverNarrowRole() {
        PrincipalBinding admin = new PrincipalBinding("admin-1", Role.ADMIN, EnumSet.of(Permission.READ_PROMOTIONS));

        assertEquals(Role.ADMIN.getPermissions(), PermissionPolicy.effectivePermissions(admin));
        assertTrue(PermissionPolicy.userHasPermission(admin, Permission.OVERRIDE_VALIDATION));
    }

    @Test
    void testAnyPermission() {
        PrincipalBinding user = PrincipalBinding.of("user-1", Role.USER);

        assertTrue(PermissionPolicy.userHasAnyPermission(user,
            List.of(Permission.MANAGE_SYSTEM, Permission.READ_PROMOTIONS)));
        assertFalse(PermissionPolicy.userHasAnyPermission(user,
            List.of(Permission.MANAGE_SYSTEM, Permission.READ_EVIDENCE)));
    }

    @Test
    void testNullPrincipalHasNothing() {
        assertTrue(PermissionPolicy.effectivePermissions(null).isEmpty());
        assertFalse(PermissionPolicy.userHasPermission(null, Permission.READ_PROMOTIONS));
    }

    @Test
    void testGuardAllows() {
        assertDoesNotThrow(() -> accessGuard.require(PrincipalBinding.of("admin-1", Role.ADMIN),
            Permission.OVERRIDE_VALIDATION, "activation:abc"));
    }

    @Test
    void testGuardDeniesWithDistinctException() {
        PermissionDeniedException e = assertThrows(PermissionDeniedException.class,
            () -> accessGuard.require(PrincipalBinding.of("rev-1", Role.REVIEWER),
                Permission.OVERRIDE_VALIDATION, "activation:abc"));

        assertEquals("rev-1", e.getPrincipalId());
        assertEquals(Permission.OVERRIDE_VALIDATION.getCode(), e.getPermission());
    }

    @Test
    void testGuardFailsClosedWithoutPrincipal() {
        assertThrows(PermissionDeniedException.class,
            () -> accessGuard.require(null, Permission.READ_PROMOTIONS, "activation:abc"));
    }

    @Test
    void testGuardRequireAny() {
        PrincipalBinding reviewer = PrincipalBinding.of("rev-1", Role.REVIEWER);

        assertDoesNotThrow(() -> accessGuard.requireAny(reviewer,
            List.of(Permission.WRITE_EVIDENCE, Permission.READ_EVIDENCE), "evidence"));
        assertThrows(PermissionDeniedException.class, () -> accessGuard.requireAny(reviewer,
            List.of(Permission.WRITE_EVIDENCE, Permission.MANAGE_SYSTEM), "evidence"));
    }
}
