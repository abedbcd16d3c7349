package com.flagship.hospital_cash.cash;

import lombok.Value;

import java.math.BigDecimal;
import java.util.UUID;

@Value
public class CashItemRecord {
    UUID uuid;
    UUID cashUuid;
    UUID invoiceUuid;
    BigDecimal amount;
}
