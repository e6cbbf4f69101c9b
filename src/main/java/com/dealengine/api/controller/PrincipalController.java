package com.dealengine.api.controller;

import com.dealengine.api.dto.BindPrincipalRequest;
import com.dealengine.security.PermissionPolicy;
import com.dealengine.security.Permission;
import com.dealengine.security.PrincipalBinding;
import com.dealengine.security.PrincipalService;
import com.dealengine.security.Role;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.EnumSet;
import java.util.Set;
import java.util.TreeSet;
import java.util.stream.Collectors;

/**
 * REST API for role bindings.
 */
@RestController
@RequestMapping("/api/v1/principals")
@RequiredArgsConstructor
@Tag(name = "Principals", description = "Role and permission binding API")
public class PrincipalController {

    private final PrincipalService principalService;

    @GetMapping("/me/permissions")
    @Operation(summary = "List the caller's effective permission codes")
    public ResponseEntity<Set<String>> getMyPermissions(
            @RequestHeader(ApiHeaders.PRINCIPAL_ID) String principalId) {
        PrincipalBinding principal = principalService.resolve(principalId);
        Set<String> codes = PermissionPolicy.effectivePermissions(principal).stream()
            .map(Permission::getCode)
            .collect(Collectors.toCollection(TreeSet::new));
        return ResponseEntity.ok(codes);
    }

    @PutMapping("/{targetPrincipalId}")
    @Operation(summary = "Assign a role and explicit permissions to a principal")
    public ResponseEntity<PrincipalBinding> bind(
            @RequestHeader(ApiHeaders.PRINCIPAL_ID) String principalId,
            @PathVariable String targetPrincipalId,
            @Valid @RequestBody BindPrincipalRequest request) {
        PrincipalBinding actor = principalService.resolve(principalId);
        PrincipalBinding binding = principalService.bind(
            actor, targetPrincipalId, Role.fromString(request.getRole()), toPermissions(request.getExplicitPermissions()));
        return ResponseEntity.ok(binding);
    }

    private static Set<Permission> toPermissions(Set<String> codes) {
        EnumSet<Permission> permissions = EnumSet.noneOf(Permission.class);
        if (codes == null) {
            return permissions;
        }
        for (String code : codes) {
            permissions.add(Permission.fromCode(code)
                .orElseThrow(() -> new IllegalArgumentException("Unknown permission: " + code)));
        }
        return permissions;
    }
}
