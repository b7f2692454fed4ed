package tech.syncbridge.platform.store;

import java.sql.Connection;
import java.sql.SQLException;

/**
 * Unit of JDBC work run against the store's connection.
 */
@FunctionalInterface
public interface SqlWork<T> {

    T execute(Connection connection) throws SQLException;
}
