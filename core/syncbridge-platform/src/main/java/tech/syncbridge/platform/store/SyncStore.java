package tech.syncbridge.platform.store;

import jakarta.annotation.PreDestroy;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.jboss.logging.Logger;
import org.sqlite.SQLiteDataSource;

import java.sql.Connection;
import java.sql.SQLException;
import java.sql.Statement;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Owns the single SQLite connection shared by all repositories.
 *
 * <p>Access is serialized through a reentrant lock, so repository calls made from
 * inside {@link #inTransaction(SqlWork)} on the same thread join that transaction.
 * The schema is created on first use and is safe to re-apply.</p>
 */
@ApplicationScoped
public class SyncStore {

    private static final Logger LOG = Logger.getLogger(SyncStore.class);

    private final ReentrantLock lock = new ReentrantLock();
    private final Connection connection;
    private final String dbPath;

    @Inject
    public SyncStore(StoreConfig config) {
        this(config.dbPath(), config.busyTimeout().toMillis());
    }

    SyncStore(String dbPath, long busyTimeoutMillis) {
        this.dbPath = dbPath;
        try {
            // Opened through the driver's own data source: DriverManager resolves drivers per caller class loader.
            SQLiteDataSource dataSource = new SQLiteDataSource();
            dataSource.setUrl("jdbc:sqlite:" + dbPath);
            this.connection = dataSource.getConnection();
            try (Statement stmt = connection.createStatement()) {
                stmt.execute("PRAGMA busy_timeout = " + busyTimeoutMillis);
                stmt.execute("PRAGMA foreign_keys = ON");
                if (!":memory:".equals(dbPath)) {
                    stmt.execute("PRAGMA journal_mode = WAL");
                }
            }
            StoreSchema.initialize(connection);
            LOG.infof("Sync store opened at [%s]", dbPath);
        } catch (SQLException e) {
            LOG.errorf(e, "Failed to open sync store at [%s]", dbPath);
            throw new StoreException("Failed to open sync store at " + dbPath, e);
        }
    }

    /**
     * Throwaway in-memory store, mainly for tests.
     */
    public static SyncStore inMemory() {
        return new SyncStore(":memory:", 5000);
    }

    /**
     * Run work against the connection in auto-commit mode (or inside the
     * caller's transaction when one is open on this thread).
     */
    public <T> T withConnection(SqlWork<T> work) {
        lock.lock();
        try {
            return work.execute(connection);
        } catch (SQLException e) {
            LOG.errorf(e, "Store operation failed");
            throw new StoreException("Store operation failed: " + e.getMessage(), e);
        } finally {
            lock.unlock();
        }
    }

    /**
     * Run work atomically. Nested calls join the outer transaction.
     */
    public <T> T inTransaction(SqlWork<T> work) {
        lock.lock();
        try {
            if (!connection.getAutoCommit()) {
                return work.execute(connection);
            }
            connection.setAutoCommit(false);
            try {
                T result = work.execute(connection);
                connection.commit();
                return result;
            } catch (SQLException | RuntimeException | Error e) {
                connection.rollback();
                throw e;
            } finally {
                connection.setAutoCommit(true);
            }
        } catch (SQLException e) {
            LOG.errorf(e, "Store transaction failed");
            throw new StoreException("Store transaction failed: " + e.getMessage(), e);
        } finally {
            lock.unlock();
        }
    }

    public String getDbPath() {
        return dbPath;
    }

    @PreDestroy
    void close() {
        lock.lock();
        try {
            connection.close();
            LOG.infof("Sync store at [%s] closed", dbPath);
        } catch (SQLException e) {
            LOG.warnf(e, "Failed to close sync store at [%s]", dbPath);
        } finally {
            lock.unlock();
        }
    }
}
