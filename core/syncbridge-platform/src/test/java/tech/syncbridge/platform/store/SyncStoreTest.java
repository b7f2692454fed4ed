package tech.syncbridge.platform.store;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.sql.Driver;
import java.sql.DriverManager;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import java.util.Collections;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class SyncStoreTest {

    // ==================== Opening ====================

    @Test
    @DisplayName("The store opens even when no SQLite driver is registered with DriverManager")
    void open_shouldNotDependOnDriverManager() throws SQLException {
        List<Driver> sqliteDrivers = Collections.list(DriverManager.getDrivers()).stream()
            .filter(driver -> driver instanceof org.sqlite.JDBC)
            .toList();
        for (Driver driver : sqliteDrivers) {
            DriverManager.deregisterDriver(driver);
        }
        try {
            SyncStore store = SyncStore.inMemory();

            assertThat(countRows(store, "sqlite_master")).isPositive();
            store.close();
        } finally {
            for (Driver driver : sqliteDrivers) {
                DriverManager.registerDriver(driver);
            }
        }
    }

    // ==================== Transactions ====================

    @Test
    @DisplayName("A failure inside a nested transaction rolls back the outer work too")
    void inTransaction_shouldRollBackOuterWork_whenNestedWorkFails() {
        SyncStore store = SyncStore.inMemory();
        store.withConnection(conn -> {
            try (Statement stmt = conn.createStatement()) {
                stmt.execute("CREATE TABLE scratch (id TEXT PRIMARY KEY)");
            }
            return null;
        });

        assertThatThrownBy(() -> store.inTransaction(conn -> {
            insert(store, "a");
            return store.inTransaction(inner -> {
                insert(store, "b");
                throw new IllegalStateException("boom");
            });
        })).isInstanceOf(IllegalStateException.class);

        assertThat(countRows(store, "scratch")).isZero();

        store.inTransaction(conn -> {
            insert(store, "c");
            return null;
        });
        assertThat(countRows(store, "scratch")).isEqualTo(1);
        store.close();
    }

    private static void insert(SyncStore store, String id) {
        store.withConnection(conn -> {
            try (Statement stmt = conn.createStatement()) {
                stmt.executeUpdate("INSERT INTO scratch (id) VALUES ('" + id + "')");
            }
            return null;
        });
    }

    private static int countRows(SyncStore store, String table) {
        return store.withConnection(conn -> {
            try (Statement stmt = conn.createStatement();
                 ResultSet rs = stmt.executeQuery("SELECT COUNT(*) FROM " + table)) {
                rs.next();
                return rs.getInt(1);
            }
        });
    }
}
