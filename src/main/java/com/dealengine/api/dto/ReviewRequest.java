package com.dealengine.api.dto;

import com.dealengine.evidence.ReviewOutcome;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;
import lombok.Data;

/**
 * DTO for a reviewer's verdict.
 */
@Data
public class ReviewRequest {

    @NotNull(message = "Outcome is required")
    private ReviewOutcome outcome;

    @Size(max = 1000)
    private String notes;
}
