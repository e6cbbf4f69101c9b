package com.dealengine.evidence;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;

/**
 * Repository for validation reviews.
 */
@Repository
public interface ValidationReviewRepository extends JpaRepository<ValidationReview, String> {

    List<ValidationReview> findByActivationKeyOrderByReviewedAtAsc(String activationKey);
}
