package com.adapterhost.internal.adapters.sql;

import com.adapterhost.adapters.sql.SqlField;
import com.adapterhost.adapters.sql.SqlQueryResult;
import com.adapterhost.adapters.sql.SqlTransaction;
import com.adapterhost.loader.AdapterSettings;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class JdbcSqlDatabaseTest {

    private JdbcSqlDatabase db;

    @BeforeEach
    void setUp() {
        db = JdbcSqlDatabase.forUrl("jdbc:h2:mem:adapters_" + UUID.randomUUID() + ";DB_CLOSE_DELAY=-1", "sa", "");
        db.query("CREATE TABLE users (id INT PRIMARY KEY, name VARCHAR(64), created TIMESTAMP)", null);
    }

    @AfterEach
    void tearDown() {
        db.close();
    }

    private long countUsers() {
        return db.query("SELECT id FROM users", null).rowCount();
    }

    @Test
    void query_insertReportsAffectedRowsAndSelectReturnsRows() {
        Instant created = Instant.parse("2024-05-01T12:00:00Z");

        SqlQueryResult insert = db.query("INSERT INTO users (id, name, created) VALUES (?, ?, ?)", List.of(1, "ada", created));
        SqlQueryResult select = db.query("SELECT id, name, created FROM users WHERE id = ?", List.of(1));

        assertEquals(1, insert.rowCount());
        assertTrue(insert.rows().isEmpty());
        assertEquals(1, select.rowCount());
        assertEquals(List.of("ID", "NAME", "CREATED"), select.fields().stream().map(SqlField::name).collect(Collectors.toList()));
        Map<String, Object> row = select.rows().get(0);
        assertEquals(1, row.get("ID"));
        assertEquals("ada", row.get("NAME"));
        assertEquals(created, row.get("CREATED"));
    }

    @Test
    void query_badStatementRaisesWithSqlState() {
        SqlExecutionException e = assertThrows(SqlExecutionException.class, () -> db.query("SELECT * FROM missing", null));

        assertNotNull(e.getSqlState());
        assertTrue(e.getMessage().startsWith("Query failed"));
    }

    @Test
    void transaction_commitMakesRowsVisible() {
        SqlTransaction tx = db.transaction();
        tx.query("INSERT INTO users (id, name) VALUES (?, ?)", List.of(1, "ada"));
        tx.query("INSERT INTO users (id, name) VALUES (?, ?)", List.of(2, "grace"));

        assertEquals(0, countUsers());
        assertEquals(1, db.activeTransactions());

        tx.commit();

        assertEquals(2, countUsers());
        assertEquals(0, db.activeTransactions());
    }

    @Test
    void transaction_rollbackDiscardsRowsAndFinishes() {
        SqlTransaction tx = db.transaction();
        tx.query("INSERT INTO users (id, name) VALUES (?, ?)", List.of(1, "ada"));

        tx.rollback();

        assertEquals(0, countUsers());
        assertThrows(IllegalStateException.class, tx::commit);
        assertThrows(IllegalStateException.class, () -> tx.query("SELECT 1", null));
    }

    @Test
    void close_rollsBackOpenTransactionsAndRejectsFurtherCalls() {
        SqlTransaction tx = db.transaction();
        tx.query("INSERT INTO users (id, name) VALUES (?, ?)", List.of(1, "ada"));

        db.close();

        assertEquals(0, db.activeTransactions());
        assertThrows(IllegalStateException.class, () -> db.query("SELECT 1", null));
        assertThrows(IllegalStateException.class, db::transaction);
    }

    @Test
    void module_requiresUrl() {
        JdbcSqlDatabaseModule module = new JdbcSqlDatabaseModule();

        assertThrows(IllegalArgumentException.class, () -> module.create(AdapterSettings.empty(), null));
        Object created = module.create(AdapterSettings.of(Map.of("url", "jdbc:h2:mem:module_" + UUID.randomUUID())), null);
        assertTrue(created instanceof JdbcSqlDatabase);
    }
}
