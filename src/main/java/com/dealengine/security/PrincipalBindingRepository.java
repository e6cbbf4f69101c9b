package com.dealengine.security;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

/**
 * Repository for principal role bindings.
 */
@Repository
public interface PrincipalBindingRepository extends JpaRepository<PrincipalBinding, String> {
}
