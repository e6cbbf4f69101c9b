package com.dealengine.api.dto;

import jakarta.validation.constraints.NotNull;
import lombok.Data;

/**
 * DTO for checking a condition before a deal is published.
 */
@Data
public class ValidateConditionRequest {

    @NotNull(message = "Condition is required")
    private String condition;
}
