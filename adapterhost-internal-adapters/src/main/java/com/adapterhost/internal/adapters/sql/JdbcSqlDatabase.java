package com.adapterhost.internal.adapters.sql;

import com.adapterhost.adapters.ResourceCleanup;
import com.adapterhost.adapters.sql.SqlDatabase;
import com.adapterhost.adapters.sql.SqlField;
import com.adapterhost.adapters.sql.SqlQueryResult;
import com.adapterhost.adapters.sql.SqlTransaction;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.sql.DataSource;
import java.sql.Blob;
import java.sql.Clob;
import java.sql.Connection;
import java.sql.DriverManager;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.ResultSetMetaData;
import java.sql.SQLException;
import java.sql.Timestamp;
import java.time.Instant;
import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.ZoneId;
import java.time.temporal.TemporalAccessor;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;

/**
 * {@link SqlDatabase} over JDBC. Each statement outside a transaction borrows a connection for its
 * own duration; a transaction holds one connection with auto-commit off until it finishes.
 * <p>
 * Column values are returned as the driver reports them, except timestamps (as {@link Instant}, local
 * ones read in the JVM's zone), other date/time values (ISO strings), UUIDs (strings) and LOBs
 * (string or bytes).
 */
public final class JdbcSqlDatabase implements SqlDatabase, ResourceCleanup {

    private static final Logger log = LoggerFactory.getLogger(JdbcSqlDatabase.class);

    /** Opens a new connection; the caller closes it. */
    @FunctionalInterface
    public interface ConnectionSource {
        Connection open() throws SQLException;
    }

    private final ConnectionSource connections;
    private final Set<JdbcTransaction> active = ConcurrentHashMap.newKeySet();
    private volatile boolean closed;

    public JdbcSqlDatabase(ConnectionSource connections) {
        this.connections = Objects.requireNonNull(connections, "connections");
    }

    public JdbcSqlDatabase(DataSource dataSource) {
        this(Objects.requireNonNull(dataSource, "dataSource")::getConnection);
    }

    /** @param user database user, or null to connect with the URL alone */
    public static JdbcSqlDatabase forUrl(String url, String user, String password) {
        Objects.requireNonNull(url, "url");
        return new JdbcSqlDatabase(() -> user != null
                ? DriverManager.getConnection(url, user, password)
                : DriverManager.getConnection(url));
    }

    @Override
    public SqlQueryResult query(String sql, List<Object> params) {
        checkOpen();
        try (Connection connection = connections.open()) {
            return execute(connection, sql, params);
        } catch (SQLException e) {
            throw failure("Query failed", e);
        }
    }

    @Override
    public SqlTransaction transaction() {
        checkOpen();
        Connection connection = null;
        try {
            connection = connections.open();
            connection.setAutoCommit(false);
        } catch (SQLException e) {
            closeQuietly(connection);
            throw failure("Cannot begin transaction", e);
        }
        JdbcTransaction tx = new JdbcTransaction(connection);
        active.add(tx);
        return tx;
    }

    /** Rolls back every open transaction; later calls fail. */
    @Override
    public void close() {
        closed = true;
        for (JdbcTransaction tx : List.copyOf(active)) {
            try {
                tx.rollback();
            } catch (RuntimeException e) {
                log.warn("Rollback of {} on close failed: {}", tx, e.getMessage());
            }
        }
    }

    @Override
    public void onExit() {
        close();
    }

    /** Transactions begun and not yet committed or rolled back. */
    public int activeTransactions() {
        return active.size();
    }

    private void checkOpen() {
        if (closed) {
            throw new IllegalStateException("SQL database is closed");
        }
    }

    static SqlQueryResult execute(Connection connection, String sql, List<Object> params) throws SQLException {
        Objects.requireNonNull(sql, "sql");
        try (PreparedStatement ps = connection.prepareStatement(sql)) {
            bindParams(ps, params);
            if (ps.execute()) {
                try (ResultSet rs = ps.getResultSet()) {
                    return readRows(rs);
                }
            }
            return SqlQueryResult.updated(Math.max(ps.getUpdateCount(), 0));
        }
    }

    private static void bindParams(PreparedStatement ps, List<Object> params) throws SQLException {
        if (params == null) return;
        for (int i = 0; i < params.size(); i++) {
            Object param = params.get(i);
            if (param instanceof Instant) {
                ps.setTimestamp(i + 1, Timestamp.from((Instant) param));
            } else {
                ps.setObject(i + 1, param);
            }
        }
    }

    private static SqlQueryResult readRows(ResultSet rs) throws SQLException {
        ResultSetMetaData meta = rs.getMetaData();
        int columns = meta.getColumnCount();
        List<SqlField> fields = new ArrayList<>(columns);
        for (int c = 1; c <= columns; c++) {
            fields.add(new SqlField(meta.getColumnLabel(c), meta.getColumnTypeName(c)));
        }
        List<Map<String, Object>> rows = new ArrayList<>();
        while (rs.next()) {
            Map<String, Object> row = new LinkedHashMap<>();
            for (int c = 1; c <= columns; c++) {
                row.put(fields.get(c - 1).name(), columnValue(rs.getObject(c)));
            }
            rows.add(row);
        }
        return new SqlQueryResult(rows, rows.size(), fields);
    }

    private static Object columnValue(Object value) throws SQLException {
        if (value instanceof Instant) return value;
        if (value instanceof Timestamp) return ((Timestamp) value).toInstant();
        if (value instanceof OffsetDateTime) return ((OffsetDateTime) value).toInstant();
        if (value instanceof LocalDateTime) return ((LocalDateTime) value).atZone(ZoneId.systemDefault()).toInstant();
        if (value instanceof java.sql.Date || value instanceof java.sql.Time) return value.toString();
        if (value instanceof TemporalAccessor) return value.toString();
        if (value instanceof UUID) return value.toString();
        if (value instanceof Clob) {
            Clob clob = (Clob) value;
            return clob.getSubString(1, (int) clob.length());
        }
        if (value instanceof Blob) {
            Blob blob = (Blob) value;
            return blob.getBytes(1, (int) blob.length());
        }
        return value;
    }

    private static SqlExecutionException failure(String what, SQLException e) {
        return new SqlExecutionException(what + ": " + e.getMessage(), e.getSQLState(), e);
    }

    private static void closeQuietly(Connection connection) {
        if (connection == null) return;
        try {
            connection.close();
        } catch (SQLException e) {
            log.warn("Could not close connection: {}", e.getMessage());
        }
    }

    private final class JdbcTransaction implements SqlTransaction {
        private final Connection connection;
        private boolean completed;

        private JdbcTransaction(Connection connection) {
            this.connection = connection;
        }

        @Override
        public synchronized SqlQueryResult query(String sql, List<Object> params) {
            checkActive();
            try {
                return execute(connection, sql, params);
            } catch (SQLException e) {
                throw failure("Query failed", e);
            }
        }

        @Override
        public synchronized void commit() {
            checkActive();
            try {
                connection.commit();
            } catch (SQLException e) {
                try {
                    connection.rollback();
                } catch (SQLException rollbackFailure) {
                    e.addSuppressed(rollbackFailure);
                }
                throw failure("Commit failed", e);
            } finally {
                finish();
            }
        }

        @Override
        public synchronized void rollback() {
            checkActive();
            try {
                connection.rollback();
            } catch (SQLException e) {
                throw failure("Rollback failed", e);
            } finally {
                finish();
            }
        }

        private void checkActive() {
            if (completed) {
                throw new IllegalStateException("Transaction already finished");
            }
        }

        private void finish() {
            completed = true;
            active.remove(this);
            try {
                connection.setAutoCommit(true);
            } catch (SQLException e) {
                log.debug("Could not restore auto-commit: {}", e.getMessage());
            }
            closeQuietly(connection);
        }
    }
}
