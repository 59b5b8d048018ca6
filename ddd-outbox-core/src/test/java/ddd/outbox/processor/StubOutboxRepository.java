package ddd.outbox.processor;

import ddd.outbox.memory.InMemoryOutboxRepository;
import ddd.outbox.model.MessagePriority;
import ddd.outbox.model.MessageStatus;
import ddd.outbox.model.OutboxMessage;
import ddd.outbox.spi.OutboxRepository;

import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * In-memory repository that records calls and can be told to fail.
 */
class StubOutboxRepository implements OutboxRepository {
  final InMemoryOutboxRepository delegate = new InMemoryOutboxRepository();
  final AtomicInteger fetchCalls = new AtomicInteger();
  final AtomicInteger incrementCalls = new AtomicInteger();
  final List<String> statusLog = new CopyOnWriteArrayList<>();
  volatile RuntimeException fetchFailure;
  volatile RuntimeException processedFailure;

  @Override
  public String saveMessage(OutboxMessage<?> message) {
    return delegate.saveMessage(message);
  }

  @Override
  public List<OutboxMessage<?>> getUnprocessedMessages(int limit, List<MessagePriority> priorityOrder) {
    fetchCalls.incrementAndGet();
    RuntimeException failure = fetchFailure;
    if (failure != null) {
      throw failure;
    }
    return delegate.getUnprocessedMessages(limit, priorityOrder);
  }

  @Override
  public Optional<OutboxMessage<?>> getById(String id) {
    return delegate.getById(id);
  }

  @Override
  public void updateStatus(String id, MessageStatus status, String error) {
    if (status == MessageStatus.PROCESSED && processedFailure != null) {
      throw processedFailure;
    }
    statusLog.add(id + ":" + status);
    delegate.updateStatus(id, status, error);
  }

  @Override
  public int incrementAttempt(String id) {
    incrementCalls.incrementAndGet();
    return delegate.incrementAttempt(id);
  }

  @Override
  public int deleteByStatusAndAge(Instant olderThan, MessageStatus status) {
    return delegate.deleteByStatusAndAge(olderThan, status);
  }

  @Override
  public List<OutboxMessage<?>> getFailedMessages(int limit, int maxAttempts) {
    return delegate.getFailedMessages(limit, maxAttempts);
  }

  @Override
  public boolean requeue(String id, Instant processAfter) {
    return delegate.requeue(id, processAfter);
  }

  @Override
  public int failStuckMessages(Instant claimedBefore, String error) {
    return delegate.failStuckMessages(claimedBefore, error);
  }

  OutboxMessage<?> get(String id) {
    return delegate.getById(id).orElseThrow();
  }
}
