package com.flagship.coin_ledger.gate.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.constraints.NotNull;
import lombok.Value;

import java.util.UUID;

@Value
public class ConnectionRequestBody {

    @NotNull(message = "Target account ID is required")
    @JsonProperty("target_account_id")
    UUID targetAccountId;

    @JsonProperty("related_post_id")
    UUID relatedPostId;
}
