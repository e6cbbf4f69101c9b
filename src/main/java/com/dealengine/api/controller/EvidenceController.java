package com.dealengine.api.controller;

import com.dealengine.api.dto.ReviewRequest;
import com.dealengine.api.dto.StoreEvidenceRequest;
import com.dealengine.evidence.EvidenceRecord;
import com.dealengine.evidence.EvidenceService;
import com.dealengine.evidence.ValidationReview;
import com.dealengine.evidence.ValidationReviewService;
import com.dealengine.security.PrincipalBinding;
import com.dealengine.security.PrincipalService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;

/**
 * REST API for activation evidence and reviewer verdicts.
 */
@RestController
@RequestMapping("/api/v1/activations/{activationKey}")
@RequiredArgsConstructor
@Tag(name = "Evidence", description = "Activation evidence and review API")
public class EvidenceController {

    private final EvidenceService evidenceService;
    private final ValidationReviewService reviewService;
    private final PrincipalService principalService;

    @GetMapping("/evidence")
    @Operation(summary = "List evidence stored for an activation")
    public ResponseEntity<List<EvidenceRecord>> getEvidence(
            @RequestHeader(ApiHeaders.PRINCIPAL_ID) String principalId,
            @PathVariable String activationKey) {
        PrincipalBinding principal = principalService.resolve(principalId);
        return ResponseEntity.ok(evidenceService.listForActivation(principal, activationKey));
    }

    @PostMapping("/evidence")
    @Operation(summary = "Attach evidence to an activation")
    public ResponseEntity<EvidenceRecord> storeEvidence(
            @RequestHeader(ApiHeaders.PRINCIPAL_ID) String principalId,
            @PathVariable String activationKey,
            @Valid @RequestBody StoreEvidenceRequest request) {
        PrincipalBinding principal = principalService.resolve(principalId);
        EvidenceRecord record = evidenceService.store(principal, activationKey, request.getKind(), request.getPayload());
        return ResponseEntity.status(HttpStatus.CREATED).body(record);
    }

    @GetMapping("/reviews")
    @Operation(summary = "List reviewer verdicts for an activation")
    public ResponseEntity<List<ValidationReview>> getReviews(
            @RequestHeader(ApiHeaders.PRINCIPAL_ID) String principalId,
            @PathVariable String activationKey) {
        PrincipalBinding principal = principalService.resolve(principalId);
        return ResponseEntity.ok(reviewService.listReviews(principal, activationKey));
    }

    @PostMapping("/reviews")
    @Operation(summary = "Record a reviewer verdict")
    public ResponseEntity<ValidationReview> review(
            @RequestHeader(ApiHeaders.PRINCIPAL_ID) String principalId,
            @PathVariable String activationKey,
            @Valid @RequestBody ReviewRequest request) {
        PrincipalBinding principal = principalService.resolve(principalId);
        ValidationReview review = reviewService.recordReview(
            principal, activationKey, request.getOutcome(), request.getNotes());
        return ResponseEntity.status(HttpStatus.CREATED).body(review);
    }
}
