package ddd.outbox.jdbc;

import ddd.outbox.jdbc.store.AbstractJdbcOutboxStore;
import ddd.outbox.jdbc.store.JdbcOutboxStores;
import ddd.outbox.model.MessagePriority;
import ddd.outbox.model.MessageStatus;
import ddd.outbox.model.OutboxMessage;
import ddd.outbox.spi.OutboxRepository;

import javax.sql.DataSource;
import java.sql.Connection;
import java.sql.SQLException;
import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * {@link OutboxRepository} over a relational table.
 *
 * <p>If a {@link TxContext} is configured and a transaction is active on the calling thread,
 * statements run on the transaction's connection, so a saved message commits or rolls back
 * with the business write. Otherwise each call borrows an auto-commit connection from the
 * {@link ConnectionProvider}.
 *
 * <pre>{@code
 * JdbcOutboxRepository repository = JdbcOutboxRepository.builder()
 *     .dataSource(dataSource)
 *     .txContext(txContext)
 *     .build();
 * }</pre>
 */
public final class JdbcOutboxRepository implements OutboxRepository {

  private final AbstractJdbcOutboxStore store;
  private final ConnectionProvider connectionProvider;
  private final TxContext txContext;
  private final Clock clock;

  private JdbcOutboxRepository(Builder builder) {
    this.connectionProvider = Objects.requireNonNull(builder.connectionProvider, "connectionProvider");
    this.store = builder.store != null ? builder.store : detectStore(builder);
    this.txContext = builder.txContext;
    this.clock = builder.clock != null ? builder.clock : Clock.systemUTC();
  }

  public static Builder builder() {
    return new Builder();
  }

  public AbstractJdbcOutboxStore store() {
    return store;
  }

  @Override
  public String saveMessage(OutboxMessage<?> message) {
    Objects.requireNonNull(message, "message");
    execute(conn -> {
      store.insert(conn, message);
      return null;
    });
    return message.id();
  }

  /**
   * Saves all messages atomically. Outside a caller's transaction the batch runs in a
   * local transaction of its own.
   */
  @Override
  public List<String> saveBatch(List<? extends OutboxMessage<?>> messages) {
    Objects.requireNonNull(messages, "messages");
    List<String> ids = new ArrayList<>(messages.size());
    if (messages.isEmpty()) {
      return ids;
    }
    if (inTransaction()) {
      for (OutboxMessage<?> message : messages) {
        store.insert(txContext.currentConnection(), message);
        ids.add(message.id());
      }
      return ids;
    }
    try (Connection conn = connectionProvider.getConnection()) {
      boolean autoCommit = conn.getAutoCommit();
      conn.setAutoCommit(false);
      try {
        for (OutboxMessage<?> message : messages) {
          store.insert(conn, message);
          ids.add(message.id());
        }
        conn.commit();
      } catch (RuntimeException e) {
        rollbackQuietly(conn, e);
        throw e;
      } finally {
        conn.setAutoCommit(autoCommit);
      }
    } catch (SQLException e) {
      throw new OutboxStoreException("Failed to save outbox batch", e);
    }
    return ids;
  }

  @Override
  public List<OutboxMessage<?>> getUnprocessedMessages(int limit, List<MessagePriority> priorityOrder) {
    Objects.requireNonNull(priorityOrder, "priorityOrder");
    if (priorityOrder.isEmpty()) {
      throw new IllegalArgumentException("priorityOrder cannot be empty");
    }
    if (limit <= 0) {
      return List.of();
    }
    return execute(conn -> store.selectPending(conn, clock.instant(), limit, priorityOrder));
  }

  @Override
  public Optional<OutboxMessage<?>> getById(String id) {
    return Optional.ofNullable(execute(conn -> store.selectById(conn, id)));
  }

  @Override
  public void updateStatus(String id, MessageStatus status, String error) {
    Objects.requireNonNull(status, "status");
    if (status == MessageStatus.PROCESSING) {
      execute(conn -> store.claim(conn, id, clock.instant()));
      return;
    }
    execute(conn -> store.updateStatus(conn, id, status, error));
  }

  @Override
  public int incrementAttempt(String id) {
    return execute(conn -> store.incrementAttempt(conn, id));
  }

  @Override
  public int deleteByStatusAndAge(Instant olderThan, MessageStatus status) {
    Objects.requireNonNull(olderThan, "olderThan");
    Objects.requireNonNull(status, "status");
    return execute(conn -> store.deleteByStatusAndAge(conn, olderThan, status));
  }

  @Override
  public List<OutboxMessage<?>> getFailedMessages(int limit, int maxAttempts) {
    if (limit <= 0) {
      return List.of();
    }
    return execute(conn -> store.selectFailed(conn, limit, maxAttempts));
  }

  @Override
  public boolean requeue(String id, Instant processAfter) {
    return execute(conn -> store.requeue(conn, id, processAfter)) > 0;
  }

  @Override
  public int failStuckMessages(Instant claimedBefore, String error) {
    Objects.requireNonNull(claimedBefore, "claimedBefore");
    return execute(conn -> store.failStuck(conn, claimedBefore, error));
  }

  private boolean inTransaction() {
    return txContext != null && txContext.isTransactionActive();
  }

  private <R> R execute(StoreCall<R> call) {
    if (inTransaction()) {
      return call.apply(txContext.currentConnection());
    }
    try (Connection conn = connectionProvider.getConnection()) {
      return call.apply(conn);
    } catch (SQLException e) {
      throw new OutboxStoreException("Failed to obtain outbox connection", e);
    }
  }

  private static void rollbackQuietly(Connection conn, RuntimeException failure) {
    try {
      conn.rollback();
    } catch (SQLException e) {
      failure.addSuppressed(e);
    }
  }

  private static AbstractJdbcOutboxStore detectStore(Builder builder) {
    if (builder.dataSource != null) {
      return JdbcOutboxStores.detect(builder.dataSource);
    }
    try (Connection conn = builder.connectionProvider.getConnection()) {
      return JdbcOutboxStores.detect(conn.getMetaData().getURL());
    } catch (SQLException e) {
      throw new IllegalStateException("Failed to detect outbox store", e);
    }
  }

  @FunctionalInterface
  private interface StoreCall<R> {
    R apply(Connection conn);
  }

  /** Builder for {@link JdbcOutboxRepository}. */
  public static final class Builder {
    private ConnectionProvider connectionProvider;
    private DataSource dataSource;
    private AbstractJdbcOutboxStore store;
    private TxContext txContext;
    private Clock clock;

    private Builder() {
    }

    /**
     * Uses {@code dataSource} for connections outside a caller's transaction.
     *
     * <p><b>Required</b> unless {@link #connectionProvider} is set.
     */
    public Builder dataSource(DataSource dataSource) {
      this.dataSource = dataSource;
      this.connectionProvider = dataSource == null ? null : new DataSourceConnectionProvider(dataSource);
      return this;
    }

    public Builder connectionProvider(ConnectionProvider connectionProvider) {
      this.connectionProvider = connectionProvider;
      return this;
    }

    /**
     * Optional. Detected from the connection's JDBC URL when not set.
     */
    public Builder store(AbstractJdbcOutboxStore store) {
      this.store = store;
      return this;
    }

    /**
     * Optional. Without one, every call uses its own auto-commit connection.
     */
    public Builder txContext(TxContext txContext) {
      this.txContext = txContext;
      return this;
    }

    /**
     * Optional. Clock for the eligibility cutoff. Defaults to {@link Clock#systemUTC()}.
     */
    public Builder clock(Clock clock) {
      this.clock = clock;
      return this;
    }

    public JdbcOutboxRepository build() {
      return new JdbcOutboxRepository(this);
    }
  }
}
