package com.adapterhost.adapters.sql;

import java.util.List;

/**
 * Open transaction. After {@link #commit()} or {@link #rollback()} the transaction is finished and
 * further calls fail.
 */
public interface SqlTransaction {

    SqlQueryResult query(String sql, List<Object> params);

    void commit();

    void rollback();
}
