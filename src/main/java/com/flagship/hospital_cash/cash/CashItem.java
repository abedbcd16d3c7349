package com.flagship.hospital_cash.cash;

import lombok.Value;

import java.util.UUID;

/**
 * A cash item ready to be staged. Its amount is computed by the database.
 */
@Value
public class CashItem {
    UUID uuid;
    UUID cashUuid;
    UUID invoiceUuid;
}
