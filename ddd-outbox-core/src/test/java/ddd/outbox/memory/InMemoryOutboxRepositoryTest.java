package ddd.outbox.memory;

import ddd.outbox.model.MessagePriority;
import ddd.outbox.model.MessageStatus;
import ddd.outbox.model.OutboxMessage;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class InMemoryOutboxRepositoryTest {

  private static final Instant NOW = Instant.parse("2024-06-01T12:00:00Z");

  private InMemoryOutboxRepository repository;

  @BeforeEach
  void setUp() {
    repository = new InMemoryOutboxRepository(Clock.fixed(NOW, ZoneOffset.UTC));
  }

  @Test
  void saveRejectsDuplicateId() {
    OutboxMessage<String> message = message("a", MessagePriority.NORMAL, NOW);
    assertEquals(message.id(), repository.saveMessage(message));

    assertThrows(IllegalArgumentException.class, () -> repository.saveMessage(message));
  }

  @Test
  void saveBatchStoresAll() {
    List<String> ids = repository.saveBatch(List.of(
        message("a", MessagePriority.NORMAL, NOW), message("b", MessagePriority.NORMAL, NOW)));

    assertEquals(2, ids.size());
    assertEquals(2, repository.size());
  }

  @Test
  void unprocessedOrderedByPriorityThenCreatedAt() {
    repository.saveMessage(message("low", MessagePriority.LOW, NOW.minusSeconds(50)));
    repository.saveMessage(message("normal-new", MessagePriority.NORMAL, NOW.minusSeconds(10)));
    repository.saveMessage(message("normal-old", MessagePriority.NORMAL, NOW.minusSeconds(20)));
    repository.saveMessage(message("critical", MessagePriority.CRITICAL, NOW.minusSeconds(1)));
    repository.saveMessage(message("high", MessagePriority.HIGH, NOW.minusSeconds(5)));

    assertEquals(List.of("critical", "high", "normal-old", "normal-new", "low"),
        payloads(repository.getUnprocessedMessages(10)));
    assertEquals(List.of("critical", "high"), payloads(repository.getUnprocessedMessages(2)));
  }

  @Test
  void customPriorityOrderPutsUnlistedPrioritiesLast() {
    repository.saveMessage(message("critical", MessagePriority.CRITICAL, NOW.minusSeconds(3)));
    repository.saveMessage(message("low", MessagePriority.LOW, NOW.minusSeconds(2)));
    repository.saveMessage(message("normal", MessagePriority.NORMAL, NOW.minusSeconds(1)));

    List<OutboxMessage<?>> batch = repository.getUnprocessedMessages(10,
        List.of(MessagePriority.LOW, MessagePriority.NORMAL));

    assertEquals(List.of("low", "normal", "critical"), payloads(batch));
  }

  @Test
  void unprocessedExcludesFutureAndNonPending() {
    repository.saveMessage(message("due", MessagePriority.NORMAL, NOW.minusSeconds(5))
        .toBuilder().processAfter(NOW).build());
    repository.saveMessage(message("later", MessagePriority.NORMAL, NOW.minusSeconds(5))
        .toBuilder().processAfter(NOW.plusSeconds(1)).build());
    repository.saveMessage(message("failed", MessagePriority.NORMAL, NOW.minusSeconds(5))
        .toBuilder().status(MessageStatus.FAILED).build());

    assertEquals(List.of("due"), payloads(repository.getUnprocessedMessages(10)));
  }

  @Test
  void processedIsNeverReverted() {
    OutboxMessage<String> message = message("a", MessagePriority.NORMAL, NOW);
    repository.saveMessage(message);

    repository.updateStatus(message.id(), MessageStatus.PROCESSED);
    repository.updateStatus(message.id(), MessageStatus.FAILED, "late failure");
    repository.incrementAttempt(message.id());

    OutboxMessage<?> stored = repository.getById(message.id()).orElseThrow();
    assertEquals(MessageStatus.PROCESSED, stored.status());
    assertEquals(0, stored.attempts());
  }

  @Test
  void failedStatusRecordsError() {
    OutboxMessage<String> message = message("a", MessagePriority.NORMAL, NOW);
    repository.saveMessage(message);

    assertEquals(1, repository.incrementAttempt(message.id()));
    repository.updateStatus(message.id(), MessageStatus.FAILED, "boom");

    OutboxMessage<?> stored = repository.getById(message.id()).orElseThrow();
    assertEquals(MessageStatus.FAILED, stored.status());
    assertEquals(1, stored.attempts());
    assertEquals("boom", stored.lastError());
  }

  @Test
  void unknownIdsAreNoOps() {
    repository.updateStatus("missing", MessageStatus.PROCESSED);
    assertEquals(0, repository.incrementAttempt("missing"));
    assertFalse(repository.requeue("missing", NOW));
    assertTrue(repository.getById("missing").isEmpty());
  }

  @Test
  void updateStatusBatchAppliesToEach() {
    OutboxMessage<String> a = message("a", MessagePriority.NORMAL, NOW);
    OutboxMessage<String> b = message("b", MessagePriority.NORMAL, NOW);
    repository.saveBatch(List.of(a, b));

    repository.updateStatusBatch(List.of(a.id(), b.id()), MessageStatus.PROCESSED);

    assertEquals(MessageStatus.PROCESSED, repository.getById(a.id()).orElseThrow().status());
    assertEquals(MessageStatus.PROCESSED, repository.getById(b.id()).orElseThrow().status());
  }

  @Test
  void scheduleMessageSetsProcessAfter() {
    Instant later = NOW.plus(Duration.ofMinutes(5));
    String id = repository.scheduleMessage(message("a", MessagePriority.NORMAL, NOW), later);

    assertEquals(later, repository.getById(id).orElseThrow().processAfter());
    assertTrue(repository.getUnprocessedMessages(10).isEmpty());
  }

  @Test
  void deleteByStatusAndAgeOnlyRemovesOlderMatching() {
    OutboxMessage<String> oldProcessed = message("a", MessagePriority.NORMAL, NOW.minusSeconds(100))
        .toBuilder().status(MessageStatus.PROCESSED).build();
    OutboxMessage<String> newProcessed = message("b", MessagePriority.NORMAL, NOW)
        .toBuilder().status(MessageStatus.PROCESSED).build();
    OutboxMessage<String> oldPending = message("c", MessagePriority.NORMAL, NOW.minusSeconds(100));
    repository.saveBatch(List.of(oldProcessed, newProcessed, oldPending));

    assertEquals(1, repository.deleteByStatusAndAge(NOW.minusSeconds(10), MessageStatus.PROCESSED));

    assertTrue(repository.getById(oldProcessed.id()).isEmpty());
    assertEquals(2, repository.size());
  }

  @Test
  void failedMessagesFilteredByAttemptsAndRequeued() {
    OutboxMessage<String> retryable = message("a", MessagePriority.NORMAL, NOW.minusSeconds(2))
        .toBuilder().status(MessageStatus.FAILED).attempts(2).build();
    OutboxMessage<String> exhausted = message("b", MessagePriority.NORMAL, NOW.minusSeconds(1))
        .toBuilder().status(MessageStatus.FAILED).attempts(3).build();
    repository.saveBatch(List.of(retryable, exhausted));

    List<OutboxMessage<?>> failed = repository.getFailedMessages(10, 3);
    assertEquals(List.of("a"), payloads(failed));

    Instant retryAt = NOW.plusSeconds(30);
    assertTrue(repository.requeue(retryable.id(), retryAt));
    assertFalse(repository.requeue(retryable.id(), retryAt));

    OutboxMessage<?> stored = repository.getById(retryable.id()).orElseThrow();
    assertEquals(MessageStatus.PENDING, stored.status());
    assertEquals(retryAt, stored.processAfter());
    assertEquals(2, stored.attempts());
  }

  @Test
  void stuckProcessingMessagesAreFailedByClaimTime() {
    OutboxMessage<String> claimed = message("claimed", MessagePriority.NORMAL, NOW);
    OutboxMessage<String> unclaimed = message("unclaimed", MessagePriority.NORMAL, NOW)
        .toBuilder().status(MessageStatus.PROCESSING).build();
    OutboxMessage<String> done = message("done", MessagePriority.NORMAL, NOW);
    repository.saveBatch(List.of(claimed, unclaimed, done));
    repository.updateStatus(claimed.id(), MessageStatus.PROCESSING);
    repository.updateStatus(done.id(), MessageStatus.PROCESSED);

    assertEquals(1, repository.failStuckMessages(NOW.minusSeconds(1), "stuck"));
    assertEquals(MessageStatus.PROCESSING, repository.getById(claimed.id()).orElseThrow().status());

    assertEquals(1, repository.failStuckMessages(NOW.plusSeconds(1), "stuck"));
    OutboxMessage<?> stored = repository.getById(claimed.id()).orElseThrow();
    assertEquals(MessageStatus.FAILED, stored.status());
    assertEquals(1, stored.attempts());
    assertEquals("stuck", stored.lastError());
    assertEquals(MessageStatus.FAILED, repository.getById(unclaimed.id()).orElseThrow().status());
    assertEquals(MessageStatus.PROCESSED, repository.getById(done.id()).orElseThrow().status());
  }

  private static OutboxMessage<String> message(String payload, MessagePriority priority, Instant createdAt) {
    return OutboxMessage.builder("Test", payload).priority(priority).createdAt(createdAt).build();
  }

  private static List<Object> payloads(List<OutboxMessage<?>> messages) {
    return messages.stream().map(m -> (Object) m.payload()).toList();
  }
}
