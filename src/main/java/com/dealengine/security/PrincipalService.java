package com.dealengine.security;

import com.dealengine.common.exception.PermissionDeniedException;
import com.dealengine.common.exception.UnknownPrincipalException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.Set;

/**
 * Service for loading and managing principal role bindings.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class PrincipalService {

    private final PrincipalBindingRepository principalBindingRepository;
    private final AccessGuard accessGuard;

    /**
     * Load the binding for an already authenticated principal id.
     *
     * @throws UnknownPrincipalException if the id is blank or has no binding
     */
    @Transactional(readOnly = true)
    public PrincipalBinding resolve(String principalId) {
        if (principalId == null || principalId.isBlank()) {
            throw new UnknownPrincipalException(principalId);
        }
        return principalBindingRepository.findById(principalId)
            .orElseThrow(() -> new UnknownPrincipalException(principalId));
    }

    /**
     * Create or replace a principal's binding. The actor needs MANAGE_USERS and may
     * not hand out a role or a permission it does not hold itself.
     */
    @Transactional
    public PrincipalBinding bind(PrincipalBinding actor, String principalId, Role role, Set<Permission> explicitPermissions) {
        accessGuard.require(actor, Permission.MANAGE_USERS, "principal:" + principalId);
        if (!PermissionPolicy.hasRoleLevel(actor.getRole(), role)) {
            throw new PermissionDeniedException(actor.getPrincipalId(), "assign role " + role);
        }
        if (explicitPermissions != null
                && !PermissionPolicy.effectivePermissions(actor).containsAll(explicitPermissions)) {
            throw new PermissionDeniedException(actor.getPrincipalId(), "grant " + explicitPermissions);
        }

        PrincipalBinding binding = new PrincipalBinding(principalId, role, explicitPermissions);
        principalBindingRepository.save(binding);

        log.info("Bound principal {} to role {} with explicit permissions {} (by {})",
            principalId, role, binding.getExplicitPermissions(), actor.getPrincipalId());
        return binding;
    }

    /**
     * Make sure the identity used for automatic actions is bound to the SYSTEM role.
     */
    @EventListener(ApplicationReadyEvent.class)
    @Transactional
    public void ensureSystemPrincipal() {
        if (!principalBindingRepository.existsById(PrincipalBinding.SYSTEM_PRINCIPAL_ID)) {
            principalBindingRepository.save(PrincipalBinding.system());
            log.info("Bound system principal '{}'", PrincipalBinding.SYSTEM_PRINCIPAL_ID);
        }
    }
}
