package com.flagship.hospital_cash.cash.dto;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.util.UUID;

/**
 * One invoice settled by a cash payment.
 *
 * The cash window sends the whole invoice row; only the identifiers matter here.
 * {@code cash_uuid} is always overwritten with the parent payment's uuid.
 */
@Value
@Builder
@Jacksonized
@JsonIgnoreProperties(ignoreUnknown = true)
public class CashItemRequest {

    @JsonProperty("uuid")
    UUID uuid;

    @JsonProperty("cash_uuid")
    UUID cashUuid;

    @JsonProperty("invoice_uuid")
    UUID invoiceUuid;
}
