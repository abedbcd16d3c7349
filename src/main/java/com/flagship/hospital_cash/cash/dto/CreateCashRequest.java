package com.flagship.hospital_cash.cash.dto;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotNull;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

/**
 * Body of {@code POST /api/cash}: {@code {"payment": {...}}}.
 */
@Value
@Builder
@Jacksonized
@JsonIgnoreProperties(ignoreUnknown = true)
public class CreateCashRequest {

    @Valid
    @NotNull(message = "Payment is required")
    @JsonProperty("payment")
    CashPaymentRequest payment;
}
