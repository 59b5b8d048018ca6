package ddd.outbox.spring.boot;

import ddd.outbox.jdbc.TxContext;
import org.springframework.jdbc.datasource.DataSourceUtils;
import org.springframework.transaction.support.TransactionSynchronizationManager;

import javax.sql.DataSource;
import java.sql.Connection;
import java.util.Objects;

/**
 * {@link TxContext} backed by Spring's {@link TransactionSynchronizationManager}, so outbox
 * writes made inside a {@code @Transactional} method join that transaction.
 *
 * <p>Requires transaction synchronization to be active, which is Spring's default.
 */
public final class SpringTxContext implements TxContext {
  private final DataSource dataSource;

  public SpringTxContext(DataSource dataSource) {
    this.dataSource = Objects.requireNonNull(dataSource, "dataSource");
  }

  @Override
  public boolean isTransactionActive() {
    return TransactionSynchronizationManager.isActualTransactionActive();
  }

  @Override
  public Connection currentConnection() {
    if (!isTransactionActive()) {
      throw new IllegalStateException("No active transaction");
    }
    if (!TransactionSynchronizationManager.isSynchronizationActive()) {
      throw new IllegalStateException(
          "Transaction synchronization is not active; cannot obtain connection safely");
    }
    return DataSourceUtils.getConnection(dataSource);
  }
}
