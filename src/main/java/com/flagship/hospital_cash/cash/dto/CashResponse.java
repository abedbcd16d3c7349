package com.flagship.hospital_cash.cash.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.hospital_cash.cash.CashItemRecord;
import com.flagship.hospital_cash.cash.CashRecord;
import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.List;
import java.util.UUID;

/**
 * A written cash payment as returned by {@code GET /api/cash/{uuid}}.
 */
@Value
@Builder
public class CashResponse {

    @JsonProperty("uuid")
    UUID uuid;

    @JsonProperty("amount")
    BigDecimal amount;

    @JsonProperty("currency_id")
    Integer currencyId;

    @JsonProperty("cashbox_id")
    Integer cashboxId;

    @JsonProperty("debtor_uuid")
    UUID debtorUuid;

    @JsonProperty("project_id")
    Integer projectId;

    @JsonProperty("user_id")
    Integer userId;

    @JsonProperty("date")
    Instant date;

    @JsonProperty("is_caution")
    boolean caution;

    @JsonProperty("description")
    String description;

    @JsonProperty("items")
    List<Item> items;

    public static CashResponse from(CashRecord cash) {
        return CashResponse.builder()
            .uuid(cash.getUuid())
            .amount(cash.getAmount())
            .currencyId(cash.getCurrencyId())
            .cashboxId(cash.getCashboxId())
            .debtorUuid(cash.getDebtorUuid())
            .projectId(cash.getProjectId())
            .userId(cash.getUserId())
            .date(cash.getDate())
            .caution(cash.isCaution())
            .description(cash.getDescription())
            .items(cash.getItems().stream().map(Item::from).toList())
            .build();
    }

    @Value
    public static class Item {

        @JsonProperty("uuid")
        UUID uuid;

        @JsonProperty("invoice_uuid")
        UUID invoiceUuid;

        @JsonProperty("amount")
        BigDecimal amount;

        static Item from(CashItemRecord item) {
            return new Item(item.getUuid(), item.getInvoiceUuid(), item.getAmount());
        }
    }
}
