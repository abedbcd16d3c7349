package com.flagship.hospital_cash.cash;

import com.flagship.hospital_cash.db.BinaryUuid;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.stereotype.Repository;
import org.springframework.transaction.annotation.Transactional;

import java.sql.Timestamp;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * Read access to written cash payments. Writes go through the posting procedures only.
 */
@Repository
public class CashRepository {

    private static final String CASH_QUERY =
        "SELECT c.uuid, c.amount, c.currency_id, c.cashbox_id, c.debtor_uuid, c.project_id, " +
        "c.date, c.user_id, c.is_caution, c.description " +
        "FROM cash c WHERE c.uuid = ?";

    private static final String CASH_ITEMS_QUERY =
        "SELECT ci.uuid, ci.cash_uuid, ci.invoice_uuid, ci.amount " +
        "FROM cash_item ci WHERE ci.cash_uuid = ?";

    private final JdbcTemplate jdbcTemplate;

    public CashRepository(JdbcTemplate jdbcTemplate) {
        this.jdbcTemplate = jdbcTemplate;
    }

    @Transactional(readOnly = true)
    public Optional<CashRecord> findByUuid(UUID uuid) {
        byte[] binaryUuid = BinaryUuid.toBytes(uuid);

        List<CashRecord> rows = jdbcTemplate.query(CASH_QUERY, cashRowMapper(), binaryUuid);
        if (rows.isEmpty()) {
            return Optional.empty();
        }

        List<CashItemRecord> items = jdbcTemplate.query(CASH_ITEMS_QUERY, cashItemRowMapper(), binaryUuid);
        return Optional.of(rows.get(0).toBuilder().items(items).build());
    }

    private RowMapper<CashRecord> cashRowMapper() {
        return (rs, rowNum) -> {
            Timestamp date = rs.getTimestamp("date");
            return CashRecord.builder()
                .uuid(BinaryUuid.fromBytes(rs.getBytes("uuid")))
                .amount(rs.getBigDecimal("amount"))
                .currencyId(rs.getInt("currency_id"))
                .cashboxId(rs.getInt("cashbox_id"))
                .debtorUuid(BinaryUuid.fromBytes(rs.getBytes("debtor_uuid")))
                .projectId(rs.getInt("project_id"))
                .date(date != null ? date.toInstant() : null)
                .userId(rs.getInt("user_id"))
                .caution(rs.getBoolean("is_caution"))
                .description(rs.getString("description"))
                .items(List.of())
                .build();
        };
    }

    private RowMapper<CashItemRecord> cashItemRowMapper() {
        return (rs, rowNum) -> new CashItemRecord(
            BinaryUuid.fromBytes(rs.getBytes("uuid")),
            BinaryUuid.fromBytes(rs.getBytes("cash_uuid")),
            BinaryUuid.fromBytes(rs.getBytes("invoice_uuid")),
            rs.getBigDecimal("amount")
        );
    }
}
