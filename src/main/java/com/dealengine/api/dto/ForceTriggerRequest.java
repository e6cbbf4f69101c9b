package com.dealengine.api.dto;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;
import lombok.Data;

/**
 * DTO for manually triggering a deal for a game.
 */
@Data
public class ForceTriggerRequest {

    @NotBlank(message = "Deal ID is required")
    private String dealId;

    @NotBlank(message = "Game ID is required")
    private String gameId;

    @NotBlank(message = "Reason is required")
    @Size(max = 500)
    private String reason;
}
