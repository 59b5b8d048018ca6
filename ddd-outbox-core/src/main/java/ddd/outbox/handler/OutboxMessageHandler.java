package ddd.outbox.handler;

import ddd.outbox.model.OutboxMessage;

/**
 * Handler that delivers outbox messages of one message type.
 *
 * <p>Implementations can perform any action: publish to a message broker,
 * call an external service, update a read model. Returning normally marks the
 * message {@code PROCESSED}; throwing marks it {@code FAILED} and records the
 * failure as its last error.
 *
 * <h2>Idempotency</h2>
 * <p>Delivery is at-least-once. A handler may see the same message more than once
 * after a crash or a requeue; use {@link OutboxMessage#id()} for deduplication.
 *
 * <h2>Example</h2>
 * <pre>{@code
 * processor.registerHandler("OrderPlaced", (OutboxMessageHandler<OrderPlaced>) message ->
 *     kafkaTemplate.send("orders", message.id(), message.payload()));
 * }</pre>
 *
 * @param <T> payload type
 * @see HandlerRegistry
 */
@FunctionalInterface
public interface OutboxMessageHandler<T> {

  /**
   * Delivers a message.
   *
   * @param message the message to deliver
   * @throws Exception if delivery fails
   */
  void handle(OutboxMessage<T> message) throws Exception;
}
