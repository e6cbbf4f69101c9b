package com.dealengine.api.dto;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Pattern;
import lombok.Data;

import java.util.Map;

/**
 * DTO for attaching evidence to an activation.
 */
@Data
public class StoreEvidenceRequest {

    @NotBlank(message = "Evidence kind is required")
    @Pattern(regexp = "[A-Z_]{1,40}", message = "Kind must be upper-case letters and underscores")
    private String kind;

    @NotNull(message = "Payload is required")
    private Map<String, Object> payload;
}
