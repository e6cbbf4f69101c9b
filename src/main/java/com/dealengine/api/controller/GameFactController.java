package com.dealengine.api.controller;

import com.dealengine.api.dto.GameFactRequest;
import com.dealengine.security.AccessGuard;
import com.dealengine.security.Permission;
import com.dealengine.security.PrincipalBinding;
import com.dealengine.security.PrincipalService;
import com.dealengine.trigger.DealEvaluation;
import com.dealengine.trigger.DealTriggerService;
import com.dealengine.trigger.GameProcessingReport;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

/**
 * REST API through which the game data service reports results.
 */
@RestController
@RequestMapping("/api/v1/games/facts")
@RequiredArgsConstructor
@Tag(name = "Game facts", description = "Game result intake API")
public class GameFactController {

    private final DealTriggerService dealTriggerService;
    private final PrincipalService principalService;
    private final AccessGuard accessGuard;

    @PostMapping
    @Operation(summary = "Evaluate every published deal of the team against a game result")
    public ResponseEntity<GameProcessingReport> submit(
            @RequestHeader(ApiHeaders.PRINCIPAL_ID) String principalId,
            @Valid @RequestBody GameFactRequest request) {

        PrincipalBinding principal = principalService.resolve(principalId);
        accessGuard.require(principal, Permission.MANAGE_SYSTEM, "game:" + request.getGameId());

        GameProcessingReport report = dealTriggerService.processGame(request.toFact());
        return ResponseEntity.ok(report);
    }

    @PostMapping("/deals/{dealId}")
    @Operation(summary = "Evaluate a single deal against a game result")
    public ResponseEntity<DealEvaluation> submitForDeal(
            @RequestHeader(ApiHeaders.PRINCIPAL_ID) String principalId,
            @PathVariable String dealId,
            @Valid @RequestBody GameFactRequest request) {

        PrincipalBinding principal = principalService.resolve(principalId);
        accessGuard.require(principal, Permission.MANAGE_SYSTEM, "deal:" + dealId + "/game:" + request.getGameId());

        DealEvaluation evaluation = dealTriggerService.processDeal(dealId, request.toFact());
        return ResponseEntity.ok(evaluation);
    }
}
