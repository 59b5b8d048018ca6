package ddd.outbox.jdbc.tx;

import ddd.outbox.jdbc.ConnectionProvider;

import java.sql.Connection;
import java.sql.SQLException;
import java.util.Objects;

/**
 * Transaction manager for plain JDBC applications. Obtains a connection, disables
 * auto-commit and binds it to a {@link ThreadLocalTxContext}, so outbox messages saved
 * through a {@link ddd.outbox.jdbc.JdbcOutboxRepository} sharing that context commit or roll
 * back with the business write.
 *
 * <pre>{@code
 * try (var tx = txManager.begin()) {
 *   orders.insert(tx.connection(), order);
 *   repository.saveMessage(OutboxMessageFactory.createMessage("OrderPlaced", order));
 *   tx.commit();
 * }
 * }</pre>
 */
public final class JdbcTransactionManager {
  private final ConnectionProvider connectionProvider;
  private final ThreadLocalTxContext txContext;

  public JdbcTransactionManager(ConnectionProvider connectionProvider, ThreadLocalTxContext txContext) {
    this.connectionProvider = Objects.requireNonNull(connectionProvider, "connectionProvider");
    this.txContext = Objects.requireNonNull(txContext, "txContext");
  }

  /**
   * Begins a transaction on the current thread.
   *
   * @throws SQLException          if a connection cannot be obtained
   * @throws IllegalStateException if a transaction is already active on this thread
   */
  public Transaction begin() throws SQLException {
    Connection connection = connectionProvider.getConnection();
    try {
      connection.setAutoCommit(false);
      txContext.bind(connection);
    } catch (SQLException | RuntimeException e) {
      try {
        connection.close();
      } catch (SQLException closeFailure) {
        e.addSuppressed(closeFailure);
      }
      throw e;
    }
    return new Transaction(connection, txContext);
  }

  /**
   * An active transaction. If neither {@link #commit()} nor {@link #rollback()} is called,
   * {@link #close()} rolls back.
   */
  public static final class Transaction implements AutoCloseable {
    private final Connection connection;
    private final ThreadLocalTxContext txContext;
    private boolean completed;

    private Transaction(Connection connection, ThreadLocalTxContext txContext) {
      this.connection = connection;
      this.txContext = txContext;
    }

    public Connection connection() {
      return connection;
    }

    public void commit() throws SQLException {
      if (completed) {
        return;
      }
      try {
        connection.commit();
      } catch (SQLException e) {
        try {
          connection.rollback();
        } catch (SQLException rollbackFailure) {
          e.addSuppressed(rollbackFailure);
        }
        throw e;
      } finally {
        complete();
      }
    }

    public void rollback() throws SQLException {
      if (completed) {
        return;
      }
      try {
        connection.rollback();
      } finally {
        complete();
      }
    }

    @Override
    public void close() throws SQLException {
      if (!completed) {
        rollback();
      }
    }

    private void complete() throws SQLException {
      completed = true;
      txContext.clear();
      try {
        connection.setAutoCommit(true);
      } finally {
        connection.close();
      }
    }
  }
}
