package com.flagship.coin_ledger.workflow.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;
import lombok.Value;

/**
 * Zero deltas pass validation here and are rejected by the ledger as INVALID_DELTA.
 */
@Value
public class AdjustmentRequest {

    @NotNull(message = "Delta is required")
    @JsonProperty("delta")
    Long delta;

    @NotBlank(message = "Description is required")
    @Size(max = 255, message = "Description must be at most 255 characters")
    @JsonProperty("description")
    String description;
}
