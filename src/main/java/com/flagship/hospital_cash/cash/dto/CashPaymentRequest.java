package com.flagship.hospital_cash.cash.dto;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.Valid;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.NotNull;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.List;
import java.util.UUID;

/**
 * A cash payment as submitted by the cash window.
 *
 * {@code project_id} and {@code user_id} are accepted so existing clients keep
 * working, but the service never reads them: both come from the session.
 * Other fields the cash window sends along (cashbox and debtor objects) are ignored.
 */
@Value
@Builder
@Jacksonized
@JsonIgnoreProperties(ignoreUnknown = true)
public class CashPaymentRequest {

    @JsonProperty("uuid")
    UUID uuid;

    @NotNull(message = "Amount is required")
    @DecimalMin(value = "0", inclusive = false, message = "Amount must be greater than 0")
    @JsonProperty("amount")
    BigDecimal amount;

    @NotNull(message = "Currency is required")
    @JsonProperty("currency_id")
    Integer currencyId;

    @NotNull(message = "Cashbox is required")
    @JsonProperty("cashbox_id")
    Integer cashboxId;

    @NotNull(message = "Debtor is required")
    @JsonProperty("debtor_uuid")
    UUID debtorUuid;

    @JsonProperty("project_id")
    Integer projectId;

    @JsonProperty("user_id")
    Integer userId;

    @JsonProperty("date")
    Instant date;

    /**
     * Accepts JSON booleans and the 0/1 integers older clients send.
     */
    @JsonProperty("is_caution")
    Boolean caution;

    @JsonProperty("description")
    String description;

    @Valid
    @JsonProperty("items")
    List<CashItemRequest> items;

    @JsonIgnore
    public boolean isCautionPayment() {
        return Boolean.TRUE.equals(caution);
    }

    @JsonIgnore
    public boolean hasItems() {
        return items != null && !items.isEmpty();
    }
}
