package com.adapterhost.adapters.sql;

import java.util.List;

/**
 * Relational database reached through parameterized SQL. Placeholders are positional ({@code ?}).
 */
public interface SqlDatabase {

    /**
     * Runs one statement outside any transaction.
     *
     * @param params values for the placeholders, or null when there are none
     */
    SqlQueryResult query(String sql, List<Object> params);

    /** Starts a transaction; statements run through it are invisible to others until commit. */
    SqlTransaction transaction();

    void close();
}
