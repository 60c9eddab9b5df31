package com.flagship.coin_ledger.gate.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Digits;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;
import lombok.Value;

import java.math.BigDecimal;

@Value
public class TopupRequestBody {

    @NotNull(message = "Amount is required")
    @DecimalMin(value = "0.01", message = "Amount must be greater than 0")
    @Digits(integer = 8, fraction = 2, message = "Amount must have at most 2 decimal places")
    @JsonProperty("amount_mvr")
    BigDecimal amountMvr;

    @NotBlank(message = "Payment slip is required")
    @Size(max = 255, message = "Payment slip path must be at most 255 characters")
    @JsonProperty("slip_path")
    String slipPath;
}
