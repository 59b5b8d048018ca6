package ddd.outbox.handler;

import java.util.Collections;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.TreeSet;
import java.util.concurrent.ConcurrentHashMap;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Thread-safe, per-instance registry mapping message types to handlers.
 *
 * <p>Registering a second handler for a type replaces the first and logs a warning.
 *
 * <h2>Usage</h2>
 * <pre>{@code
 * DefaultHandlerRegistry registry = new DefaultHandlerRegistry()
 *     .register("OrderPlaced", message -> orders.publish(message))
 *     .register("integration_event:UserCreated", message -> users.sync(message));
 * }</pre>
 *
 * @see OutboxMessageHandler
 * @see HandlerRegistry
 */
public final class DefaultHandlerRegistry implements HandlerRegistry {
  private static final Logger logger = Logger.getLogger(DefaultHandlerRegistry.class.getName());

  private final Map<String, OutboxMessageHandler<?>> handlers = new ConcurrentHashMap<>();

  /**
   * Registers the handler for a message type, replacing any previous one.
   *
   * @param messageType the message type
   * @param handler     the handler
   * @return this registry for chaining
   */
  public DefaultHandlerRegistry register(String messageType, OutboxMessageHandler<?> handler) {
    Objects.requireNonNull(messageType, "messageType");
    Objects.requireNonNull(handler, "handler");
    if (messageType.isEmpty()) {
      throw new IllegalArgumentException("messageType cannot be empty");
    }
    OutboxMessageHandler<?> previous = handlers.put(messageType, handler);
    if (previous != null && previous != handler) {
      logger.log(Level.WARNING, "Replaced handler for message type {0}", messageType);
    }
    return this;
  }

  /**
   * Removes the handler for a message type.
   *
   * @return {@code true} if a handler was removed
   */
  public boolean unregister(String messageType) {
    return handlers.remove(messageType) != null;
  }

  @Override
  public OutboxMessageHandler<?> handlerFor(String messageType) {
    return messageType == null ? null : handlers.get(messageType);
  }

  @Override
  public Set<String> messageTypes() {
    return Collections.unmodifiableSet(new TreeSet<>(handlers.keySet()));
  }
}
