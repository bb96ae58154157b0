package com.adapterhost.internal.adapters.sql;

/** A statement or connection failure reported by the JDBC driver. */
public class SqlExecutionException extends RuntimeException {

    private final String sqlState;

    public SqlExecutionException(String message, String sqlState, Throwable cause) {
        super(message, cause);
        this.sqlState = sqlState;
    }

    /** Driver SQLSTATE, or null. */
    public String getSqlState() {
        return sqlState;
    }
}
