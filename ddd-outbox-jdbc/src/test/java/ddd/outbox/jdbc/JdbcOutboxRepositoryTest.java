package ddd.outbox.jdbc;

import ddd.outbox.jdbc.tx.JdbcTransactionManager;
import ddd.outbox.jdbc.tx.ThreadLocalTxContext;
import ddd.outbox.model.MessagePriority;
import ddd.outbox.model.MessageStatus;
import ddd.outbox.model.OutboxMessage;
import ddd.outbox.requeue.FailedMessageRequeuer;
import org.h2.jdbcx.JdbcDataSource;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.sql.SQLException;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.time.temporal.ChronoUnit;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class JdbcOutboxRepositoryTest {

  private static final Instant NOW = Instant.parse("2024-06-01T12:00:00Z");

  private JdbcDataSource dataSource;
  private ThreadLocalTxContext txContext;
  private JdbcOutboxRepository repository;

  @BeforeEach
  void setUp() throws SQLException {
    dataSource = H2Database.create();
    txContext = new ThreadLocalTxContext();
    repository = JdbcOutboxRepository.builder()
        .dataSource(dataSource)
        .txContext(txContext)
        .clock(Clock.fixed(NOW, ZoneOffset.UTC))
        .build();
  }

  // ── Store detection ─────────────────────────────────────────────

  @Test
  void detectsH2Store() {
    assertEquals("h2", repository.store().name());
    assertEquals(TableNames.DEFAULT_TABLE, repository.store().tableName());
  }

  @Test
  void requiresConnectionSource() {
    assertThrows(NullPointerException.class, () -> JdbcOutboxRepository.builder().build());
  }

  // ── Save and read ───────────────────────────────────────────────

  @Test
  void savedMessageRoundTripsAllColumns() {
    Instant createdAt = NOW.minusSeconds(30);
    Instant processAfter = NOW.minusSeconds(5);
    OutboxMessage<Map<String, Object>> message = OutboxMessage.builder("OrderPlaced",
            Map.<String, Object>of("orderId", "o-1", "amount", 42))
        .metadata("traceId", "t-1")
        .priority(MessagePriority.HIGH)
        .createdAt(createdAt)
        .processAfter(processAfter)
        .build();

    assertEquals(message.id(), repository.saveMessage(message));

    OutboxMessage<?> stored = repository.getById(message.id()).orElseThrow();
    assertEquals("OrderPlaced", stored.messageType());
    assertEquals(Map.of("orderId", "o-1", "amount", 42), stored.payload());
    assertEquals(Map.of("traceId", "t-1"), stored.metadata());
    assertEquals(MessageStatus.PENDING, stored.status());
    assertEquals(MessagePriority.HIGH, stored.priority());
    assertEquals(0, stored.attempts());
    assertEquals(createdAt, stored.createdAt());
    assertEquals(processAfter, stored.processAfter());
    assertNull(stored.lastError());
  }

  @Test
  void registeredPayloadTypeIsRestored() throws SQLException {
    JdbcOutboxRepository typed = JdbcOutboxRepository.builder()
        .dataSource(dataSource)
        .store(repository.store().withPayloadCodec(JacksonPayloadCodec.builder()
            .payloadType("OrderPlaced", OrderPlaced.class)
            .build()))
        .build();
    OutboxMessage<OrderPlaced> message = OutboxMessage.builder("OrderPlaced", new OrderPlaced("o-1", 3)).build();

    typed.saveMessage(message);

    OrderPlaced payload = assertInstanceOf(OrderPlaced.class, typed.getById(message.id()).orElseThrow().payload());
    assertEquals("o-1", payload.orderId);
    assertEquals(3, payload.quantity);
  }

  @Test
  void nullPayloadAndEmptyMetadataAreAllowed() {
    OutboxMessage<Object> message = OutboxMessage.builder("Ping", null).build();
    repository.saveMessage(message);

    OutboxMessage<?> stored = repository.getById(message.id()).orElseThrow();
    assertNull(stored.payload());
    assertTrue(stored.metadata().isEmpty());
  }

  @Test
  void duplicateIdFails() {
    OutboxMessage<String> message = OutboxMessage.builder("t", "x").build();
    repository.saveMessage(message);

    assertThrows(OutboxStoreException.class, () -> repository.saveMessage(message));
  }

  @Test
  void unknownIdIsEmpty() {
    assertTrue(repository.getById("missing").isEmpty());
  }

  // ── Eligibility and ordering ────────────────────────────────────

  @Test
  void unprocessedOrderedByPriorityThenCreatedAt() {
    save("low", MessagePriority.LOW, NOW.minusSeconds(50));
    save("normal-new", MessagePriority.NORMAL, NOW.minusSeconds(10));
    save("normal-old", MessagePriority.NORMAL, NOW.minusSeconds(20));
    save("critical", MessagePriority.CRITICAL, NOW.minusSeconds(1));
    save("high", MessagePriority.HIGH, NOW.minusSeconds(5));

    assertEquals(List.of("critical", "high", "normal-old", "normal-new", "low"),
        payloads(repository.getUnprocessedMessages(10)));
    assertEquals(List.of("critical", "high"), payloads(repository.getUnprocessedMessages(2)));
    assertEquals(List.of("low", "normal-old", "normal-new", "high", "critical"),
        payloads(repository.getUnprocessedMessages(10, List.of(MessagePriority.LOW, MessagePriority.NORMAL))));
  }

  @Test
  void emptyPriorityOrderIsRejected() {
    save("a", MessagePriority.NORMAL, NOW);

    assertThrows(IllegalArgumentException.class, () -> repository.getUnprocessedMessages(10, List.of()));
  }

  @Test
  void futureAndNonPendingMessagesAreNotReturned() {
    repository.saveMessage(message("due", NOW.minusSeconds(5)).toBuilder().processAfter(NOW).build());
    repository.saveMessage(message("later", NOW.minusSeconds(5)).toBuilder().processAfter(NOW.plusSeconds(1)).build());
    repository.saveMessage(message("failed", NOW.minusSeconds(5)).toBuilder().status(MessageStatus.FAILED).build());

    assertEquals(List.of("due"), payloads(repository.getUnprocessedMessages(10)));
  }

  // ── Status transitions ──────────────────────────────────────────

  @Test
  void failureRecordsErrorAndAttempts() {
    OutboxMessage<String> message = save("a", MessagePriority.NORMAL, NOW);

    assertEquals(1, repository.incrementAttempt(message.id()));
    repository.updateStatus(message.id(), MessageStatus.FAILED, "boom");

    OutboxMessage<?> stored = repository.getById(message.id()).orElseThrow();
    assertEquals(MessageStatus.FAILED, stored.status());
    assertEquals(1, stored.attempts());
    assertEquals("boom", stored.lastError());
  }

  @Test
  void longErrorsAreTruncated() {
    OutboxMessage<String> message = save("a", MessagePriority.NORMAL, NOW);

    repository.updateStatus(message.id(), MessageStatus.FAILED, "x".repeat(5000));

    String error = repository.getById(message.id()).orElseThrow().lastError();
    assertEquals(4000, error.length());
    assertTrue(error.endsWith("..."));
  }

  @Test
  void processedIsNeverReverted() {
    OutboxMessage<String> message = save("a", MessagePriority.NORMAL, NOW);

    repository.updateStatus(message.id(), MessageStatus.PROCESSED);
    repository.updateStatus(message.id(), MessageStatus.FAILED, "late");
    assertEquals(0, repository.incrementAttempt(message.id()));

    OutboxMessage<?> stored = repository.getById(message.id()).orElseThrow();
    assertEquals(MessageStatus.PROCESSED, stored.status());
    assertNull(stored.lastError());
  }

  @Test
  void unknownIdUpdatesAreNoOps() {
    repository.updateStatus("missing", MessageStatus.PROCESSED);
    assertEquals(0, repository.incrementAttempt("missing"));
    assertFalse(repository.requeue("missing", NOW));
  }

  @Test
  void updateStatusBatchAppliesToAll() {
    OutboxMessage<String> a = save("a", MessagePriority.NORMAL, NOW);
    OutboxMessage<String> b = save("b", MessagePriority.NORMAL, NOW);

    repository.updateStatusBatch(List.of(a.id(), b.id()), MessageStatus.PROCESSING);

    assertEquals(MessageStatus.PROCESSING, repository.getById(a.id()).orElseThrow().status());
    assertEquals(MessageStatus.PROCESSING, repository.getById(b.id()).orElseThrow().status());
  }

  // ── Requeue and purge ───────────────────────────────────────────

  @Test
  void failedMessagesBelowMaxAttemptsAreRequeued() {
    OutboxMessage<String> retryable = repositorySave(message("a", NOW.minusSeconds(2)).toBuilder()
        .status(MessageStatus.FAILED).attempts(1).build());
    repositorySave(message("b", NOW.minusSeconds(1)).toBuilder()
        .status(MessageStatus.FAILED).attempts(5).build());

    assertEquals(List.of("a"), payloads(repository.getFailedMessages(10, 5)));

    Instant retryAt = NOW.plusSeconds(30);
    assertTrue(repository.requeue(retryable.id(), retryAt));
    assertFalse(repository.requeue(retryable.id(), retryAt));

    OutboxMessage<?> stored = repository.getById(retryable.id()).orElseThrow();
    assertEquals(MessageStatus.PENDING, stored.status());
    assertEquals(retryAt, stored.processAfter());
  }

  @Test
  void stuckProcessingMessagesAreFailedByClaimTime() {
    OutboxMessage<String> claimed = save("claimed", MessagePriority.NORMAL, NOW);
    OutboxMessage<String> unclaimed = repositorySave(message("unclaimed", NOW).toBuilder()
        .status(MessageStatus.PROCESSING).build());
    OutboxMessage<String> done = save("done", MessagePriority.NORMAL, NOW);
    repository.updateStatus(claimed.id(), MessageStatus.PROCESSING);
    repository.updateStatus(done.id(), MessageStatus.PROCESSED);

    assertEquals(1, repository.failStuckMessages(NOW.minusSeconds(1), "stuck"));
    assertEquals(MessageStatus.PROCESSING, repository.getById(claimed.id()).orElseThrow().status());
    assertEquals(MessageStatus.FAILED, repository.getById(unclaimed.id()).orElseThrow().status());

    assertEquals(1, repository.failStuckMessages(NOW.plusSeconds(1), "stuck"));
    OutboxMessage<?> stored = repository.getById(claimed.id()).orElseThrow();
    assertEquals(MessageStatus.FAILED, stored.status());
    assertEquals(1, stored.attempts());
    assertEquals("stuck", stored.lastError());
    assertEquals(MessageStatus.PROCESSED, repository.getById(done.id()).orElseThrow().status());
  }

  @Test
  void requeueSweepRecoversStuckProcessingMessage() {
    OutboxMessage<String> message = save("a", MessagePriority.NORMAL, NOW);
    repository.updateStatus(message.id(), MessageStatus.PROCESSING);
    Instant later = NOW.plus(Duration.ofMinutes(10));

    try (FailedMessageRequeuer requeuer = FailedMessageRequeuer.builder()
        .repository(repository)
        .retryPolicy(attempts -> 0L)
        .stuckTimeout(Duration.ofMinutes(5))
        .clock(Clock.fixed(later, ZoneOffset.UTC))
        .build()) {
      assertEquals(1, requeuer.runOnce());
    }

    JdbcOutboxRepository laterRepository = JdbcOutboxRepository.builder()
        .dataSource(dataSource)
        .clock(Clock.fixed(later, ZoneOffset.UTC))
        .build();
    List<OutboxMessage<?>> pending = laterRepository.getUnprocessedMessages(10);
    assertEquals(List.of("a"), payloads(pending));
    assertEquals(1, pending.get(0).attempts());
  }

  @Test
  void deleteByStatusAndAge() throws SQLException {
    repositorySave(message("old", NOW.minusSeconds(100)).toBuilder().status(MessageStatus.PROCESSED).build());
    repositorySave(message("new", NOW).toBuilder().status(MessageStatus.PROCESSED).build());
    repositorySave(message("pending", NOW.minusSeconds(100)));

    assertEquals(1, repository.deleteByStatusAndAge(NOW.minusSeconds(10), MessageStatus.PROCESSED));
    assertEquals(2, H2Database.count(dataSource));
  }

  // ── Transactions ────────────────────────────────────────────────

  @Test
  void saveJoinsCommittedTransaction() throws SQLException {
    JdbcTransactionManager txManager = new JdbcTransactionManager(
        new DataSourceConnectionProvider(dataSource), txContext);
    OutboxMessage<String> message = message("a", NOW);

    try (JdbcTransactionManager.Transaction tx = txManager.begin()) {
      repository.saveMessage(message);
      assertEquals(0, H2Database.count(dataSource));
      tx.commit();
    }

    assertTrue(repository.getById(message.id()).isPresent());
  }

  @Test
  void saveRollsBackWithTransaction() throws SQLException {
    JdbcTransactionManager txManager = new JdbcTransactionManager(
        new DataSourceConnectionProvider(dataSource), txContext);

    try (JdbcTransactionManager.Transaction tx = txManager.begin()) {
      repository.saveBatch(List.of(message("a", NOW), message("b", NOW)));
    }

    assertEquals(0, H2Database.count(dataSource));
    assertFalse(txContext.isTransactionActive());
  }

  @Test
  void saveBatchIsAtomicWithoutTransaction() throws SQLException {
    OutboxMessage<String> existing = repositorySave(message("a", NOW));

    assertThrows(OutboxStoreException.class,
        () -> repository.saveBatch(List.of(message("b", NOW), existing)));

    assertEquals(1, H2Database.count(dataSource));
  }

  private OutboxMessage<String> save(String payload, MessagePriority priority, Instant createdAt) {
    return repositorySave(message(payload, createdAt).toBuilder().priority(priority).build());
  }

  private OutboxMessage<String> repositorySave(OutboxMessage<String> message) {
    repository.saveMessage(message);
    return message;
  }

  private static OutboxMessage<String> message(String payload, Instant createdAt) {
    return OutboxMessage.builder("Test", payload).createdAt(createdAt.truncatedTo(ChronoUnit.MILLIS)).build();
  }

  private static List<Object> payloads(List<OutboxMessage<?>> messages) {
    return messages.stream().map(m -> (Object) m.payload()).toList();
  }

  public static final class OrderPlaced {
    public String orderId;
    public int quantity;

    public OrderPlaced() {
    }

    OrderPlaced(String orderId, int quantity) {
      this.orderId = orderId;
      this.quantity = quantity;
    }
  }
}
