package com.dealengine.api.dto;

import jakarta.validation.constraints.NotBlank;
import lombok.Data;

import java.util.HashSet;
import java.util.Set;

/**
 * DTO for assigning a role and explicit permissions to a principal.
 *
 * Roles are matched case-insensitively; permissions accept either the wire code
 * ({@code evidence:write}) or the enum name ({@code WRITE_EVIDENCE}).
 */
@Data
public class BindPrincipalRequest {

    @NotBlank(message = "Role is required")
    private String role;

    private Set<String> explicitPermissions = new HashSet<>();
}
