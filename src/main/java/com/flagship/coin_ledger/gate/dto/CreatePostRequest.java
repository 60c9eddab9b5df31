package com.flagship.coin_ledger.gate.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;
import lombok.Value;

@Value
public class CreatePostRequest {

    @NotBlank(message = "Title is required")
    @Size(max = 120, message = "Title must be at most 120 characters")
    @JsonProperty("title")
    String title;

    @NotBlank(message = "Body is required")
    @Size(max = 4000, message = "Body must be at most 4000 characters")
    @JsonProperty("body")
    String body;
}
