package ddd.outbox.handler;

import java.util.Set;

/**
 * Registry for looking up the handler of a message type.
 *
 * <p>Each message type maps to at most one handler.
 *
 * @see DefaultHandlerRegistry
 */
public interface HandlerRegistry {

  /**
   * Returns the handler registered for {@code messageType}.
   *
   * @param messageType the message type to look up
   * @return the handler, or {@code null} if none is registered
   */
  OutboxMessageHandler<?> handlerFor(String messageType);

  /**
   * Returns the message types that currently have a handler.
   */
  Set<String> messageTypes();
}
