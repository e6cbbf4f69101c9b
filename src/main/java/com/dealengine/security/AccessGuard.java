package com.dealengine.security;

import com.dealengine.common.exception.PermissionDeniedException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.Collection;
import java.util.stream.Collectors;

/**
 * Fail-closed permission gate in front of every manual entry point.
 *
 * Every check, allowed or denied, is written to the audit log. Checks happen
 * before any lookup, so a denial says nothing about whether the resource exists.
 */
@Component
@Slf4j
public class AccessGuard {

    public void require(PrincipalBinding principal, Permission permission, String resource) {
        boolean allowed = PermissionPolicy.userHasPermission(principal, permission);
        audit(principal, permission.getCode(), allowed, resource);
        if (!allowed) {
            throw new PermissionDeniedException(principalId(principal), permission.getCode());
        }
    }

    public void requireAny(PrincipalBinding principal, Collection<Permission> permissions, String resource) {
        boolean allowed = PermissionPolicy.userHasAnyPermission(principal, permissions);
        String codes = permissions.stream().map(Permission::getCode).collect(Collectors.joining("|"));
        audit(principal, codes, allowed, resource);
        if (!allowed) {
            throw new PermissionDeniedException(principalId(principal), codes);
        }
    }

    private void audit(PrincipalBinding principal, String permission, boolean allowed, String resource) {
        if (allowed) {
            log.info("Permission check: principal={} permission={} resource={} ALLOWED",
                principalId(principal), permission, resource);
        } else {
            log.warn("Permission check: principal={} permission={} resource={} DENIED",
                principalId(principal), permission, resource);
        }
    }

    private static String principalId(PrincipalBinding principal) {
        return principal == null ? "anonymous" : principal.getPrincipalId();
    }
}
