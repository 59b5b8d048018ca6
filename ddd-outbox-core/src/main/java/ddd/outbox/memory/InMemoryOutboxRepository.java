package ddd.outbox.memory;

import ddd.outbox.model.MessagePriority;
import ddd.outbox.model.MessageStatus;
import ddd.outbox.model.OutboxMessage;
import ddd.outbox.spi.OutboxRepository;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Thread-safe {@link OutboxRepository} kept in memory.
 *
 * <p>Suitable for tests and single-process setups where losing pending messages on restart
 * is acceptable. Operations on an unknown id are no-ops, matching the JDBC repository.
 */
public final class InMemoryOutboxRepository implements OutboxRepository {
  private final Map<String, OutboxMessage<?>> messages = new LinkedHashMap<>();
  private final Map<String, Instant> claims = new HashMap<>();
  private final Clock clock;

  public InMemoryOutboxRepository() {
    this(Clock.systemUTC());
  }

  public InMemoryOutboxRepository(Clock clock) {
    this.clock = Objects.requireNonNull(clock, "clock");
  }

  @Override
  public synchronized String saveMessage(OutboxMessage<?> message) {
    Objects.requireNonNull(message, "message");
    if (messages.containsKey(message.id())) {
      throw new IllegalArgumentException("Duplicate message id: " + message.id());
    }
    messages.put(message.id(), message);
    return message.id();
  }

  @Override
  public synchronized List<OutboxMessage<?>> getUnprocessedMessages(int limit,
      List<MessagePriority> priorityOrder) {
    Objects.requireNonNull(priorityOrder, "priorityOrder");
    Instant now = clock.instant();
    Comparator<OutboxMessage<?>> order = Comparator
        .<OutboxMessage<?>>comparingInt(m -> rank(priorityOrder, m.priority()))
        .thenComparing(OutboxMessage::createdAt)
        .thenComparing(OutboxMessage::id);
    return messages.values().stream()
        .filter(m -> m.isEligibleAt(now))
        .sorted(order)
        .limit(Math.max(0, limit))
        .toList();
  }

  @Override
  public synchronized Optional<OutboxMessage<?>> getById(String id) {
    return Optional.ofNullable(messages.get(id));
  }

  @Override
  public synchronized void updateStatus(String id, MessageStatus status, String error) {
    Objects.requireNonNull(status, "status");
    OutboxMessage<?> current = messages.get(id);
    if (current == null || current.status() == MessageStatus.PROCESSED) {
      return;
    }
    var builder = current.toBuilder().status(status);
    if (status == MessageStatus.FAILED && error != null) {
      builder.lastError(error);
    }
    messages.put(id, builder.build());
    if (status == MessageStatus.PROCESSING) {
      claims.put(id, clock.instant());
    } else {
      claims.remove(id);
    }
  }

  @Override
  public synchronized int incrementAttempt(String id) {
    OutboxMessage<?> current = messages.get(id);
    if (current == null) {
      return 0;
    }
    if (current.status() == MessageStatus.PROCESSED) {
      return current.attempts();
    }
    int attempts = current.attempts() + 1;
    messages.put(id, current.toBuilder().attempts(attempts).build());
    return attempts;
  }

  @Override
  public synchronized int deleteByStatusAndAge(Instant olderThan, MessageStatus status) {
    int before = messages.size();
    messages.values().removeIf(m -> m.status() == status && m.createdAt().isBefore(olderThan));
    claims.keySet().retainAll(messages.keySet());
    return before - messages.size();
  }

  @Override
  public synchronized List<OutboxMessage<?>> getFailedMessages(int limit, int maxAttempts) {
    return messages.values().stream()
        .filter(m -> m.status() == MessageStatus.FAILED && m.attempts() < maxAttempts)
        .sorted(Comparator.<OutboxMessage<?>, Instant>comparing(OutboxMessage::createdAt)
            .thenComparing(OutboxMessage::id))
        .limit(Math.max(0, limit))
        .toList();
  }

  @Override
  public synchronized boolean requeue(String id, Instant processAfter) {
    OutboxMessage<?> current = messages.get(id);
    if (current == null || current.status() != MessageStatus.FAILED) {
      return false;
    }
    messages.put(id, current.toBuilder()
        .status(MessageStatus.PENDING)
        .processAfter(processAfter)
        .build());
    return true;
  }

  @Override
  public synchronized int failStuckMessages(Instant claimedBefore, String error) {
    Objects.requireNonNull(claimedBefore, "claimedBefore");
    int moved = 0;
    for (OutboxMessage<?> current : new ArrayList<>(messages.values())) {
      if (current.status() != MessageStatus.PROCESSING) {
        continue;
      }
      Instant claimedAt = claims.get(current.id());
      if (claimedAt != null && !claimedAt.isBefore(claimedBefore)) {
        continue;
      }
      messages.put(current.id(), current.toBuilder()
          .status(MessageStatus.FAILED)
          .attempts(current.attempts() + 1)
          .lastError(error)
          .build());
      claims.remove(current.id());
      moved++;
    }
    return moved;
  }

  public synchronized int size() {
    return messages.size();
  }

  /**
   * Returns every stored message in insertion order.
   */
  public synchronized List<OutboxMessage<?>> findAll() {
    return new ArrayList<>(messages.values());
  }

  public synchronized void clear() {
    messages.clear();
    claims.clear();
  }

  private static int rank(List<MessagePriority> priorityOrder, MessagePriority priority) {
    int index = priorityOrder.indexOf(priority);
    return index < 0 ? priorityOrder.size() : index;
  }
}
