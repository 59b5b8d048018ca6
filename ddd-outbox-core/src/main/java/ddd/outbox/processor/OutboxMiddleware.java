package ddd.outbox.processor;

import ddd.outbox.model.OutboxMessage;

import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Cross-cutting wrapper around message delivery.
 *
 * <p>Middlewares are applied in registration order, outermost first: with
 * {@code use(a).use(b)} a delivery runs as {@code a(b(handler))}. A middleware may
 * observe or alter the message, short-circuit by throwing, or act after the inner
 * layers return. A failure raised by any layer marks the message {@code FAILED}.
 *
 * <h2>Example</h2>
 * <pre>{@code
 * processor
 *     .use(OutboxMiddleware.before(message ->
 *         audit.log(message.messageType(), message.id())))
 *     .use(OutboxMiddleware.after((message, error) -> {
 *         if (error != null) alerts.notify(message.id(), error);
 *     }))
 *     .use(Middlewares.timeout(Duration.ofSeconds(30)));
 * }</pre>
 *
 * @see Middlewares
 */
@FunctionalInterface
public interface OutboxMiddleware {

  /**
   * Wraps the next layer of the pipeline.
   *
   * @param next the inner delivery
   * @return the wrapped delivery
   */
  MessageDelivery wrap(MessageDelivery next);

  /**
   * Creates a middleware that runs {@code hook} before the inner layers.
   * If the hook throws, the inner layers are skipped.
   */
  static OutboxMiddleware before(BeforeHook hook) {
    return next -> message -> {
      hook.accept(message);
      next.deliver(message);
    };
  }

  /**
   * Creates a middleware that runs {@code hook} after the inner layers, with the failure
   * or {@code null}. Exceptions thrown by the hook are logged and swallowed.
   */
  static OutboxMiddleware after(AfterHook hook) {
    return next -> message -> {
      Exception error = null;
      try {
        next.deliver(message);
      } catch (Exception e) {
        error = e;
        throw e;
      } finally {
        try {
          hook.accept(message, error);
        } catch (RuntimeException e) {
          Logger.getLogger(OutboxMiddleware.class.getName())
              .log(Level.WARNING, "After-delivery hook failed for message " + message.id(), e);
        }
      }
    };
  }

  @FunctionalInterface
  interface BeforeHook {
    void accept(OutboxMessage<?> message) throws Exception;
  }

  @FunctionalInterface
  interface AfterHook {
    void accept(OutboxMessage<?> message, Exception error);
  }
}
