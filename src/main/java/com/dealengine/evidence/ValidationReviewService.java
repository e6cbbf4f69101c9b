package com.dealengine.evidence;

import com.dealengine.activation.ActivationService;
import com.dealengine.security.AccessGuard;
import com.dealengine.security.Permission;
import com.dealengine.security.PrincipalBinding;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;

/**
 * Service for reviewer verdicts on activations.
 *
 * Reviewers record an outcome; they cannot change the activation itself.
 * A DISPUTED verdict is a signal for an administrator to reverse.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class ValidationReviewService {

    private final ValidationReviewRepository reviewRepository;
    private final ActivationService activationService;
    private final AccessGuard accessGuard;

    @Transactional
    public ValidationReview recordReview(PrincipalBinding reviewer, String activationKey,
                                         ReviewOutcome outcome, String notes) {
        accessGuard.require(reviewer, Permission.REVIEW_VALIDATION, activationKey);
        if (outcome == null) {
            throw new IllegalArgumentException("Review outcome is required");
        }
        activationService.getActivation(activationKey);

        ValidationReview review = new ValidationReview(activationKey, reviewer.getPrincipalId(), outcome, notes);
        reviewRepository.save(review);

        if (outcome == ReviewOutcome.DISPUTED) {
            log.warn("Activation {} DISPUTED by {}: {}", activationKey, reviewer.getPrincipalId(), notes);
        } else {
            log.info("Activation {} reviewed as {} by {}", activationKey, outcome, reviewer.getPrincipalId());
        }
        return review;
    }

    /**
     * Anyone who may read evidence or record a review may see the recorded verdicts.
     */
    @Transactional(readOnly = true)
    public List<ValidationReview> listReviews(PrincipalBinding actor, String activationKey) {
        accessGuard.requireAny(actor, List.of(Permission.READ_EVIDENCE, Permission.REVIEW_VALIDATION), activationKey);
        return reviewRepository.findByActivationKeyOrderByReviewedAtAsc(activationKey);
    }
}
