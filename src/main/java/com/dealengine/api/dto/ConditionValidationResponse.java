package com.dealengine.api.dto;

import lombok.Value;

/**
 * How a condition was understood.
 */
@Value
public class ConditionValidationResponse {
    String normalized;
    String signature;
    String description;
}
