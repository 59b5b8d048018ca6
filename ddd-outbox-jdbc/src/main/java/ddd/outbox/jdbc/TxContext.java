package ddd.outbox.jdbc;

import java.sql.Connection;

/**
 * Exposes the caller's current transaction, if any, so outbox writes can join it.
 *
 * <p>When a transaction is active, {@link JdbcOutboxRepository} runs its statements on
 * {@link #currentConnection()} and leaves commit and close to the transaction owner.
 *
 * @see ddd.outbox.jdbc.tx.ThreadLocalTxContext
 */
public interface TxContext {

  boolean isTransactionActive();

  /**
   * Returns the connection bound to the active transaction.
   *
   * @throws IllegalStateException if no transaction is active
   */
  Connection currentConnection();
}
