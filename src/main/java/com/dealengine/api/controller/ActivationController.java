package com.dealengine.api.controller;

import com.dealengine.activation.Activation;
import com.dealengine.activation.ActivationOverrideService;
import com.dealengine.activation.ActivationResult;
import com.dealengine.activation.ActivationStatus;
import com.dealengine.api.dto.ForceTriggerRequest;
import com.dealengine.api.dto.ReverseActivationRequest;
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
import java.util.Map;

/**
 * REST API for reading and overriding activations.
 */
@RestController
@RequestMapping("/api/v1/activations")
@RequiredArgsConstructor
@Tag(name = "Activations", description = "Deal activation API")
public class ActivationController {

    private final ActivationOverrideService overrideService;
    private final PrincipalService principalService;

    @GetMapping("/{activationKey}")
    @Operation(summary = "Get activation details")
    public ResponseEntity<Activation> getActivation(
            @RequestHeader(ApiHeaders.PRINCIPAL_ID) String principalId,
            @PathVariable String activationKey) {
        PrincipalBinding principal = principalService.resolve(principalId);
        return ResponseEntity.ok(overrideService.get(principal, activationKey));
    }

    @GetMapping("/active")
    @Operation(summary = "List activations that are currently redeemable")
    public ResponseEntity<List<Activation>> getActive(
            @RequestHeader(ApiHeaders.PRINCIPAL_ID) String principalId) {
        PrincipalBinding principal = principalService.resolve(principalId);
        return ResponseEntity.ok(overrideService.listActive(principal));
    }

    @GetMapping("/games/{gameId}")
    @Operation(summary = "List activations caused by a game")
    public ResponseEntity<List<Activation>> getForGame(
            @RequestHeader(ApiHeaders.PRINCIPAL_ID) String principalId,
            @PathVariable String gameId) {
        PrincipalBinding principal = principalService.resolve(principalId);
        return ResponseEntity.ok(overrideService.listForGame(principal, gameId));
    }

    @GetMapping("/status")
    @Operation(summary = "Get the lifecycle state of a deal for a game")
    public ResponseEntity<Map<String, String>> getStatus(
            @RequestHeader(ApiHeaders.PRINCIPAL_ID) String principalId,
            @RequestParam String dealId,
            @RequestParam String gameId) {
        PrincipalBinding principal = principalService.resolve(principalId);
        ActivationStatus status = overrideService.statusOf(principal, dealId, gameId);
        return ResponseEntity.ok(Map.of("dealId", dealId, "gameId", gameId, "status", status.name()));
    }

    @PostMapping("/{activationKey}/reverse")
    @Operation(summary = "Reverse a triggered activation")
    public ResponseEntity<Activation> reverse(
            @RequestHeader(ApiHeaders.PRINCIPAL_ID) String principalId,
            @PathVariable String activationKey,
            @Valid @RequestBody ReverseActivationRequest request) {
        PrincipalBinding principal = principalService.resolve(principalId);
        return ResponseEntity.ok(overrideService.reverse(principal, activationKey, request.getReason()));
    }

    @PostMapping("/force-trigger")
    @Operation(summary = "Trigger a deal for a game regardless of its condition")
    public ResponseEntity<ActivationResult> forceTrigger(
            @RequestHeader(ApiHeaders.PRINCIPAL_ID) String principalId,
            @Valid @RequestBody ForceTriggerRequest request) {
        PrincipalBinding principal = principalService.resolve(principalId);
        ActivationResult result = overrideService.forceTrigger(
            principal, request.getDealId(), request.getGameId(), request.getReason());
        HttpStatus status = result.isCreated() ? HttpStatus.CREATED : HttpStatus.OK;
        return ResponseEntity.status(status).body(result);
    }
}
