package ddd.outbox.jdbc;

import java.sql.Connection;
import java.sql.SQLException;

/**
 * Supplies JDBC connections for work done outside a caller's transaction.
 * The caller closes each returned connection.
 */
@FunctionalInterface
public interface ConnectionProvider {

  Connection getConnection() throws SQLException;
}
