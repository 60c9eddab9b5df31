package com.flagship.coin_ledger.account.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.coin_ledger.account.AccountRole;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Pattern;
import jakarta.validation.constraints.Size;
import lombok.Value;

@Value
public class CreateAccountRequest {

    @NotBlank(message = "Username is required")
    @Pattern(regexp = "^[a-z0-9_.]{3,32}$", message = "Username must be 3-32 lowercase letters, digits, '_' or '.'")
    @JsonProperty("username")
    String username;

    @NotBlank(message = "Display name is required")
    @Size(max = 120, message = "Display name must be at most 120 characters")
    @JsonProperty("display_name")
    String displayName;

    /**
     * Defaults to USER. Creating an ADMIN requires an admin caller.
     */
    @JsonProperty("role")
    AccountRole role;
}
