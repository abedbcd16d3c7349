package com.flagship.hospital_cash.db;

import lombok.RequiredArgsConstructor;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.stereotype.Component;
import org.springframework.transaction.support.TransactionTemplate;

/**
 * Entry point to the hospital database for writes that go through stored procedures.
 */
@Component
@RequiredArgsConstructor
public class DatabaseConnector {

    private final JdbcTemplate jdbcTemplate;
    private final TransactionTemplate transactionTemplate;

    /**
     * @return a new, empty transaction bound to the application data source
     */
    public Transaction transaction() {
        return new Transaction(jdbcTemplate, transactionTemplate);
    }
}
