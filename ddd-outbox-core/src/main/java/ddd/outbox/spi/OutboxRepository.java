package ddd.outbox.spi;

import ddd.outbox.model.MessagePriority;
import ddd.outbox.model.MessageStatus;
import ddd.outbox.model.OutboxMessage;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Persistence contract for outbox messages.
 *
 * <p>Every status transition of a message goes through this interface, which is what makes
 * processing crash-safe: after a restart the processor resumes by fetching unprocessed
 * messages again. Implementations report storage failures as unchecked exceptions; the
 * processor propagates them unchanged.
 *
 * <p>Implementations must never change the status of a {@link MessageStatus#PROCESSED}
 * message.
 *
 * @see ddd.outbox.memory.InMemoryOutboxRepository
 */
public interface OutboxRepository {

  /**
   * Persists a new message.
   *
   * @return the message id
   */
  String saveMessage(OutboxMessage<?> message);

  /**
   * Persists several messages. The default implementation saves them one by one.
   *
   * @return the message ids, in input order
   */
  default List<String> saveBatch(List<? extends OutboxMessage<?>> messages) {
    List<String> ids = new ArrayList<>(messages.size());
    for (OutboxMessage<?> message : messages) {
      ids.add(saveMessage(message));
    }
    return ids;
  }

  /**
   * Returns up to {@code limit} eligible messages in {@link MessagePriority#DEFAULT_ORDER}.
   */
  default List<OutboxMessage<?>> getUnprocessedMessages(int limit) {
    return getUnprocessedMessages(limit, MessagePriority.DEFAULT_ORDER);
  }

  /**
   * Returns up to {@code limit} {@code PENDING} messages whose {@code processAfter} is absent
   * or not in the future, ordered by position in {@code priorityOrder} and then by
   * {@code createdAt} ascending. Priorities missing from {@code priorityOrder} sort last.
   */
  List<OutboxMessage<?>> getUnprocessedMessages(int limit, List<MessagePriority> priorityOrder);

  Optional<OutboxMessage<?>> getById(String id);

  default void updateStatus(String id, MessageStatus status) {
    updateStatus(id, status, null);
  }

  /**
   * Sets the status of a message. For {@link MessageStatus#FAILED} the {@code error} is
   * recorded as the message's {@code lastError}. Setting {@link MessageStatus#PROCESSING}
   * records the current time as the message's claim time. Has no effect on a
   * {@code PROCESSED} message.
   */
  void updateStatus(String id, MessageStatus status, String error);

  /**
   * Applies {@link #updateStatus(String, MessageStatus)} to each id.
   */
  default void updateStatusBatch(List<String> ids, MessageStatus status) {
    for (String id : ids) {
      updateStatus(id, status);
    }
  }

  /**
   * Increments the attempt counter of a message.
   *
   * @return the new attempt count
   */
  int incrementAttempt(String id);

  /**
   * Deletes messages in {@code status} created before {@code olderThan}.
   *
   * @return number of deleted messages
   */
  int deleteByStatusAndAge(Instant olderThan, MessageStatus status);

  /**
   * Saves {@code message} with its {@code processAfter} set to the given instant.
   */
  default String scheduleMessage(OutboxMessage<?> message, Instant processAfter) {
    return saveMessage(message.toBuilder().processAfter(processAfter).build());
  }

  /**
   * Returns up to {@code limit} {@code FAILED} messages with fewer than {@code maxAttempts}
   * attempts, oldest first.
   */
  List<OutboxMessage<?>> getFailedMessages(int limit, int maxAttempts);

  /**
   * Moves a {@code FAILED} message back to {@code PENDING} with a new {@code processAfter}.
   * The attempt counter and last error are kept.
   *
   * @return {@code false} if the message does not exist or is not {@code FAILED}
   */
  boolean requeue(String id, Instant processAfter);

  /**
   * Moves {@code PROCESSING} messages claimed before {@code claimedBefore}, or with no claim
   * time, to {@code FAILED}. Each one gets an extra attempt and {@code error} as its last
   * error, so the requeue sweep can retry it.
   *
   * @return number of messages moved
   */
  int failStuckMessages(Instant claimedBefore, String error);
}
