package ddd.outbox.factory;

import ddd.outbox.model.MessagePriority;
import ddd.outbox.model.OutboxMessage;
import ddd.outbox.model.OutboxMessageOptions;

import java.time.Duration;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Construction helpers for new {@code PENDING} outbox messages.
 *
 * <p>The helpers only build values; saving them is up to the caller, usually inside the
 * same transaction as the business change:
 * <pre>{@code
 * repository.saveMessage(OutboxMessageFactory.createMessage("OrderPlaced", order));
 * repository.saveMessage(OutboxMessageFactory.createFromIntegrationEvent(event));
 * }</pre>
 */
public final class OutboxMessageFactory {

  /**
   * Message type prefix for messages built from integration events.
   */
  public static final String INTEGRATION_EVENT_PREFIX = "integration_event:";

  private OutboxMessageFactory() {
  }

  public static <T> OutboxMessage<T> createMessage(String messageType, T payload) {
    return createMessage(messageType, payload, OutboxMessageOptions.NONE);
  }

  /**
   * Creates a message with status {@code PENDING}, no attempts, {@code createdAt} now and
   * the priority, {@code processAfter} and metadata given in {@code options}.
   */
  public static <T> OutboxMessage<T> createMessage(String messageType, T payload,
      OutboxMessageOptions options) {
    Objects.requireNonNull(options, "options");
    return OutboxMessage.builder(messageType, payload)
        .createdAt(now())
        .metadata(options.metadata())
        .priority(options.priority() == null ? MessagePriority.NORMAL : options.priority())
        .processAfter(options.processAfter())
        .build();
  }

  /**
   * Creates a message that becomes eligible {@code delay} from now.
   */
  public static <T> OutboxMessage<T> createDelayedMessage(String messageType, T payload, Duration delay) {
    return createDelayedMessage(messageType, payload, delay, OutboxMessageOptions.NONE);
  }

  public static <T> OutboxMessage<T> createDelayedMessage(String messageType, T payload, Duration delay,
      OutboxMessageOptions options) {
    Objects.requireNonNull(delay, "delay");
    Objects.requireNonNull(options, "options");
    if (delay.isNegative()) {
      throw new IllegalArgumentException("delay must be >= 0");
    }
    Instant now = now();
    return OutboxMessage.builder(messageType, payload)
        .createdAt(now)
        .metadata(options.metadata())
        .priority(options.priority() == null ? MessagePriority.NORMAL : options.priority())
        .processAfter(now.plus(delay))
        .build();
  }

  public static <T> OutboxMessage<T> createHighPriorityMessage(String messageType, T payload) {
    return createHighPriorityMessage(messageType, payload, OutboxMessageOptions.NONE);
  }

  /**
   * Creates a {@link MessagePriority#HIGH} message; a priority in {@code options} is ignored.
   */
  public static <T> OutboxMessage<T> createHighPriorityMessage(String messageType, T payload,
      OutboxMessageOptions options) {
    return createMessage(messageType, payload, options).toBuilder()
        .priority(MessagePriority.HIGH)
        .build();
  }

  public static <T> OutboxMessage<T> createFromIntegrationEvent(IntegrationEvent<T> event) {
    return createFromIntegrationEvent(event, OutboxMessageOptions.NONE);
  }

  /**
   * Creates a message of type {@code integration_event:<eventType>} carrying the event's
   * payload and metadata. Metadata in {@code options} wins on key collision.
   */
  public static <T> OutboxMessage<T> createFromIntegrationEvent(IntegrationEvent<T> event,
      OutboxMessageOptions options) {
    Objects.requireNonNull(event, "event");
    Objects.requireNonNull(options, "options");
    Map<String, Object> metadata = new LinkedHashMap<>(event.metadata());
    metadata.putAll(options.metadata());
    return OutboxMessage.builder(integrationEventType(event.eventType()), event.payload())
        .createdAt(now())
        .metadata(metadata)
        .priority(options.priority() == null ? MessagePriority.NORMAL : options.priority())
        .processAfter(options.processAfter())
        .build();
  }

  /**
   * Returns the message type used for integration events of {@code eventType}.
   */
  public static String integrationEventType(String eventType) {
    Objects.requireNonNull(eventType, "eventType");
    if (eventType.isEmpty()) {
      throw new IllegalArgumentException("eventType cannot be empty");
    }
    return INTEGRATION_EVENT_PREFIX + eventType;
  }

  private static Instant now() {
    return Instant.now();
  }
}
