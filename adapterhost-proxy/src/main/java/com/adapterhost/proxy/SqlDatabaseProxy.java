package com.adapterhost.proxy;

import com.adapterhost.adapters.AdapterTokens;
import com.adapterhost.adapters.sql.SqlDatabase;
import com.adapterhost.adapters.sql.SqlQueryResult;
import com.adapterhost.adapters.sql.SqlTransaction;
import com.adapterhost.codec.WireCodec;
import com.adapterhost.ipc.transport.AdapterTransport;
import com.adapterhost.ipc.transport.CallOptions;

import java.util.List;

/**
 * SQL database on the host. A transaction lives on the host under an id; the returned
 * {@link SqlTransaction} sends that id with each of its calls.
 */
public final class SqlDatabaseProxy extends RemoteAdapter implements SqlDatabase {

    public SqlDatabaseProxy(AdapterTransport transport, WireCodec codec) {
        this(AdapterTokens.SQL_DATABASE, transport, codec, null);
    }

    public SqlDatabaseProxy(String token, AdapterTransport transport, WireCodec codec, CallOptions callOptions) {
        super(token, transport, codec, callOptions);
    }

    @Override
    public SqlQueryResult query(String sql, List<Object> params) {
        return call(SqlQueryResult.class, "query", sql, params);
    }

    @Override
    public SqlTransaction transaction() {
        return new RemoteTransaction(call(String.class, "transaction"));
    }

    @Override
    public void close() {
        invoke("close");
    }

    private final class RemoteTransaction implements SqlTransaction {
        private final String id;

        private RemoteTransaction(String id) {
            this.id = id;
        }

        @Override
        public SqlQueryResult query(String sql, List<Object> params) {
            return call(SqlQueryResult.class, "transaction.query", id, sql, params);
        }

        @Override
        public void commit() {
            invoke("transaction.commit", id);
        }

        @Override
        public void rollback() {
            invoke("transaction.rollback", id);
        }

        @Override
        public String toString() {
            return "RemoteTransaction{" + id + "}";
        }
    }
}
