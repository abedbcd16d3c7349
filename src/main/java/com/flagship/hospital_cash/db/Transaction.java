package com.flagship.hospital_cash.db;

import lombok.extern.slf4j.Slf4j;
import org.springframework.jdbc.core.ArgumentPreparedStatementSetter;
import org.springframework.jdbc.core.CallableStatementCallback;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.transaction.support.TransactionTemplate;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * An ordered batch of stored-procedure calls executed all-or-nothing.
 *
 * Calls are queued with {@link #addProcedure(String, Object...)} and run in
 * insertion order by {@link #execute()} inside one database transaction.
 * If any call fails, every call is rolled back and the failure is rethrown
 * as-is; nothing here retries or translates it.
 *
 * Instances are single-use and not thread-safe. Obtain them from
 * {@link DatabaseConnector#transaction()}.
 */
@Slf4j
public class Transaction {

    private final JdbcTemplate jdbcTemplate;
    private final TransactionTemplate transactionTemplate;
    private final List<ProcedureCall> calls = new ArrayList<>();

    public Transaction(JdbcTemplate jdbcTemplate, TransactionTemplate transactionTemplate) {
        this.jdbcTemplate = jdbcTemplate;
        this.transactionTemplate = transactionTemplate;
    }

    /**
     * Queues a call to the named stored procedure.
     *
     * @param procedure procedure name, e.g. "StageCash"
     * @param arguments positional arguments in the procedure's parameter order
     * @return this transaction, for chaining
     */
    public Transaction addProcedure(String procedure, Object... arguments) {
        calls.add(new ProcedureCall(procedure, arguments));
        return this;
    }

    /**
     * @return the queued calls, in execution order
     */
    public List<ProcedureCall> getCalls() {
        return Collections.unmodifiableList(calls);
    }

    /**
     * Runs every queued call in one transaction.
     *
     * @throws IllegalStateException if nothing was queued
     * @throws org.springframework.dao.DataAccessException if a call or the commit fails
     */
    public void execute() {
        if (calls.isEmpty()) {
            throw new IllegalStateException("Cannot execute an empty transaction");
        }

        transactionTemplate.executeWithoutResult(status -> {
            for (ProcedureCall call : calls) {
                log.debug("Executing {}", call);
                invoke(call);
            }
        });

        log.debug("Committed transaction: calls={}", calls.size());
    }

    private void invoke(ProcedureCall call) {
        ArgumentPreparedStatementSetter setter = new ArgumentPreparedStatementSetter(call.arguments());
        jdbcTemplate.execute(call.toSql(), (CallableStatementCallback<Boolean>) statement -> {
            setter.setValues(statement);
            return statement.execute();
        });
    }
}
