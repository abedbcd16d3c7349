package com.flagship.hospital_cash.cash;

import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.List;
import java.util.UUID;

/**
 * A row of the {@code cash} table with its items, as written by the posting procedures.
 */
@Value
@Builder(toBuilder = true)
public class CashRecord {
    UUID uuid;
    BigDecimal amount;
    Integer currencyId;
    Integer cashboxId;
    UUID debtorUuid;
    Integer projectId;
    Instant date;
    Integer userId;
    boolean caution;
    String description;
    List<CashItemRecord> items;
}
