package com.dealengine.api.controller;

import com.dealengine.api.dto.ConditionValidationResponse;
import com.dealengine.api.dto.ValidateConditionRequest;
import com.dealengine.condition.Condition;
import com.dealengine.condition.ConditionCache;
import com.dealengine.security.AccessGuard;
import com.dealengine.security.Permission;
import com.dealengine.security.PrincipalBinding;
import com.dealengine.security.PrincipalService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

/**
 * REST API for authoring trigger conditions.
 */
@RestController
@RequestMapping("/api/v1/conditions")
@RequiredArgsConstructor
@Tag(name = "Conditions", description = "Trigger condition authoring API")
public class ConditionController {

    private final ConditionCache conditionCache;
    private final PrincipalService principalService;
    private final AccessGuard accessGuard;

    @PostMapping("/validate")
    @Operation(summary = "Parse a condition and describe how it was understood")
    public ResponseEntity<ConditionValidationResponse> validate(
            @RequestHeader(ApiHeaders.PRINCIPAL_ID) String principalId,
            @Valid @RequestBody ValidateConditionRequest request) {

        PrincipalBinding principal = principalService.resolve(principalId);
        accessGuard.require(principal, Permission.VALIDATE_PROMOTION, "conditions");

        Condition condition = conditionCache.compile(request.getCondition());
        return ResponseEntity.ok(new ConditionValidationResponse(
            condition.getNormalizedSource(),
            condition.getSignature(),
            condition.getPredicate().describe()
        ));
    }
}
