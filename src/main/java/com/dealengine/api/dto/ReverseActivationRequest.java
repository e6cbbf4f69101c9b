package com.dealengine.api.dto;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;
import lombok.Data;

/**
 * DTO for withdrawing a triggered activation.
 */
@Data
public class ReverseActivationRequest {

    @NotBlank(message = "Reason is required")
    @Size(max = 500)
    private String reason;
}
