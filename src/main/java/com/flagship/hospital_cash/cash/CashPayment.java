package com.flagship.hospital_cash.cash;

import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.List;
import java.util.UUID;

/**
 * A cash payment ready to be staged: identifiers assigned and server-controlled
 * fields (project, user) taken from the session.
 */
@Value
@Builder
public class CashPayment {
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
    List<CashItem> items;

    /**
     * Invoice payments settle previous invoices; caution payments are deposits.
     */
    public boolean isInvoicePayment() {
        return !caution;
    }
}
