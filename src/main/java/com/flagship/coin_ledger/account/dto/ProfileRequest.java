package com.flagship.coin_ledger.account.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;
import lombok.Value;

@Value
public class ProfileRequest {

    @NotBlank(message = "Display name is required")
    @Size(max = 120, message = "Display name must be at most 120 characters")
    @JsonProperty("display_name")
    String displayName;

    @Size(max = 4000, message = "Bio must be at most 4000 characters")
    @JsonProperty("bio")
    String bio;
}
