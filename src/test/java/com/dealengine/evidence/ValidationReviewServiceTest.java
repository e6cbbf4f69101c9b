package com.dealengine.evidence;

import com.dealengine.activation.ActivationService;
import com.dealengine.common.exception.ActivationNotFoundException;
import com.dealengine.common.exception.PermissionDeniedException;
import com.dealengine.security.AccessGuard;
import com.dealengine.security.Permission;
import com.dealengine.security.PrincipalBinding;
import com.dealengine.security.Role;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.EnumSet;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

/**
 * Unit tests for ValidationReviewService.
 */
@ExtendWith(MockitoExtension.class)
class ValidationReviewServiceTest {

    private static final String KEY = "activation:0123456789abcdef0123456789abcdef";

    @Mock
    private ValidationReviewRepository reviewRepository;

    @Mock
    private ActivationService activationService;

    private ValidationReviewService reviewService;

    @BeforeEach
    void setUp() {
        reviewService = new ValidationReviewService(reviewRepository, activationService, new AccessGuard());
    }

    @Test
    void testReviewerRecordsVerdict() {
        ValidationReview review = reviewService.recordReview(PrincipalBinding.of("rev-1", Role.REVIEWER),
            KEY, ReviewOutcome.DISPUTED, "final score was revised");

        assertEquals("rev-1", review.getReviewerId());
        assertEquals(ReviewOutcome.DISPUTED, review.getOutcome());
        verify(activationService).getActivation(KEY);
        verify(reviewRepository).save(review);
    }

    @Test
    void testUserCannotReview() {
        assertThrows(PermissionDeniedException.class, () -> reviewService.recordReview(
            PrincipalBinding.of("user-1", Role.USER), KEY, ReviewOutcome.CONFIRMED, null));
        verifyNoInteractions(activationService, reviewRepository);
    }

    @Test
    void testDenialComesBeforeLookup() {
        assertThrows(PermissionDeniedException.class, () -> reviewService.recordReview(
            PrincipalBinding.of("user-1", Role.USER), "activation:doesnotexist", ReviewOutcome.CONFIRMED, null));
        verifyNoInteractions(activationService);
    }

    @Test
    void testUnknownActivation() {
        when(activationService.getActivation(KEY)).thenThrow(new ActivationNotFoundException(KEY));

        assertThrows(ActivationNotFoundException.class, () -> reviewService.recordReview(
            PrincipalBinding.of("rev-1", Role.REVIEWER), KEY, ReviewOutcome.CONFIRMED, null));
        verify(reviewRepository, never()).save(any());
    }

    @Test
    void testOutcomeRequired() {
        assertThrows(IllegalArgumentException.class, () -> reviewService.recordReview(
            PrincipalBinding.of("rev-1", Role.REVIEWER), KEY, null, null));
    }

    @Test
    void testExplicitReviewGrantCanListReviews() {
        PrincipalBinding grantedReviewer = new PrincipalBinding("user-2", Role.USER,
            EnumSet.of(Permission.REVIEW_VALIDATION));
        when(reviewRepository.findByActivationKeyOrderByReviewedAtAsc(KEY)).thenReturn(List.of());

        assertTrue(reviewService.listReviews(grantedReviewer, KEY).isEmpty());
        verify(reviewRepository).findByActivationKeyOrderByReviewedAtAsc(KEY);
    }

    @Test
    void testUserCannotListReviews() {
        assertThrows(PermissionDeniedException.class,
            () -> reviewService.listReviews(PrincipalBinding.of("user-1", Role.USER), KEY));
        verifyNoInteractions(reviewRepository);
    }
}
