package com.flagship.hospital_cash.db;

import java.util.Arrays;
import java.util.Collections;
import java.util.Objects;
import java.util.stream.Collectors;

/**
 * A single stored-procedure invocation queued in a {@link Transaction}.
 *
 * Arguments are positional and already in the database's native form
 * (binary UUIDs, SQL timestamps).
 */
public record ProcedureCall(String procedure, Object[] arguments) {

    public ProcedureCall {
        Objects.requireNonNull(procedure, "procedure");
        if (procedure.isBlank()) {
            throw new IllegalArgumentException("Procedure name cannot be blank");
        }
        arguments = arguments == null ? new Object[0] : arguments.clone();
    }

    /**
     * Renders the JDBC call string with one placeholder per argument,
     * e.g. {@code CALL WriteCash(?)}.
     */
    public String toSql() {
        String placeholders = String.join(", ", Collections.nCopies(arguments.length, "?"));
        return "CALL " + procedure + "(" + placeholders + ")";
    }

    @Override
    public Object[] arguments() {
        return arguments.clone();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof ProcedureCall other)) {
            return false;
        }
        return procedure.equals(other.procedure) && Arrays.deepEquals(arguments, other.arguments);
    }

    @Override
    public int hashCode() {
        return 31 * procedure.hashCode() + Arrays.deepHashCode(arguments);
    }

    @Override
    public String toString() {
        return Arrays.stream(arguments)
                .map(ProcedureCall::describe)
                .collect(Collectors.joining(", ", "CALL " + procedure + "(", ")"));
    }

    private static String describe(Object argument) {
        if (argument instanceof byte[] bytes) {
            return bytes.length == BinaryUuid.LENGTH
                    ? BinaryUuid.fromBytes(bytes).toString()
                    : Arrays.toString(bytes);
        }
        return String.valueOf(argument);
    }
}
