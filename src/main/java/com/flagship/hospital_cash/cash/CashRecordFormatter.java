package com.flagship.hospital_cash.cash;

import com.flagship.hospital_cash.cash.dto.CashItemRequest;
import com.flagship.hospital_cash.db.BinaryUuid;

import java.sql.Timestamp;
import java.util.List;
import java.util.UUID;

/**
 * Shapes cash records into the positional argument arrays the staging
 * procedures expect.
 *
 * The column lists below must match the procedures' parameter order.
 */
public final class CashRecordFormatter {

    /** Parameter order of {@code StageCash}. */
    public static final List<String> CASH_COLUMNS = List.of(
        "amount", "currency_id", "cashbox_id", "debtor_uuid", "project_id", "date",
        "user_id", "is_caution", "description", "uuid"
    );

    /** Parameter order of {@code StageCashItem}. */
    public static final List<String> CASH_ITEM_COLUMNS = List.of(
        "uuid", "cash_uuid", "invoice_uuid"
    );

    private CashRecordFormatter() {
        // Utility class
    }

    /**
     * Attaches submitted items to their payment, generating item uuids where missing.
     * Any client-supplied {@code cash_uuid} is replaced.
     */
    public static List<CashItem> prepareItems(UUID cashUuid, List<CashItemRequest> items) {
        if (items == null) {
            return List.of();
        }
        return items.stream()
            .map(item -> new CashItem(
                item.getUuid() != null ? item.getUuid() : UUID.randomUUID(),
                cashUuid,
                item.getInvoiceUuid()))
            .toList();
    }

    /**
     * @return arguments for {@code StageCash}, in {@link #CASH_COLUMNS} order
     */
    public static Object[] formatPayment(CashPayment payment) {
        return new Object[] {
            payment.getAmount(),
            payment.getCurrencyId(),
            payment.getCashboxId(),
            BinaryUuid.toBytes(payment.getDebtorUuid()),
            payment.getProjectId(),
            payment.getDate() != null ? Timestamp.from(payment.getDate()) : null,
            payment.getUserId(),
            payment.isCaution(),
            payment.getDescription(),
            BinaryUuid.toBytes(payment.getUuid())
        };
    }

    /**
     * @return arguments for {@code StageCashItem}, in {@link #CASH_ITEM_COLUMNS} order
     */
    public static Object[] formatItem(CashItem item) {
        return new Object[] {
            BinaryUuid.toBytes(item.getUuid()),
            BinaryUuid.toBytes(item.getCashUuid()),
            BinaryUuid.toBytes(item.getInvoiceUuid())
        };
    }
}
