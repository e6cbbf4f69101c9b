package com.dealengine.security;

import jakarta.persistence.*;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.EnumSet;
import java.util.HashSet;
import java.util.Set;

/**
 * Role and explicit grants of a principal.
 *
 * Explicit permissions are added to the role's defaults, never substituted for them.
 */
@Entity
@Table(name = "principal_bindings")
@Data
@NoArgsConstructor
public class PrincipalBinding {

    /**
     * Identity used for automatic, evaluator-driven actions.
     */
    public static final String SYSTEM_PRINCIPAL_ID = "system";

    @Id
    private String principalId;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false)
    private Role role;

    @ElementCollection(fetch = FetchType.EAGER)
    @CollectionTable(name = "principal_permissions", joinColumns = @JoinColumn(name = "principal_id"))
    @Enumerated(EnumType.STRING)
    @Column(name = "permission")
    private Set<Permission> explicitPermissions = new HashSet<>();

    @Column(name = "created_at")
    private Instant createdAt;

    public PrincipalBinding(String principalId, Role role, Set<Permission> explicitPermissions) {
        this.principalId = principalId;
        this.role = role;
        this.explicitPermissions = explicitPermissions == null
            ? new HashSet<>()
            : new HashSet<>(explicitPermissions);
        this.createdAt = Instant.now();
    }

    public static PrincipalBinding system() {
        return new PrincipalBinding(SYSTEM_PRINCIPAL_ID, Role.SYSTEM, EnumSet.noneOf(Permission.class));
    }

    public static PrincipalBinding of(String principalId, Role role) {
        return new PrincipalBinding(principalId, role, EnumSet.noneOf(Permission.class));
    }
}
