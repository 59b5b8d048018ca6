package ddd.outbox.spring.boot;

import java.lang.annotation.Documented;
import java.lang.annotation.ElementType;
import java.lang.annotation.Retention;
import java.lang.annotation.RetentionPolicy;
import java.lang.annotation.Target;

/**
 * Marks a Spring bean as the handler for one message type.
 *
 * <p>The annotated bean must implement {@link ddd.outbox.handler.OutboxMessageHandler}.
 *
 * <pre>{@code
 * @Component
 * @OutboxHandler("OrderPlaced")
 * public class OrderPlacedHandler implements OutboxMessageHandler<Map<String, Object>> {
 *   public void handle(OutboxMessage<Map<String, Object>> message) { ... }
 * }
 * }</pre>
 *
 * @see OutboxHandlerRegistrar
 * @see IntegrationEventHandler
 */
@Target(ElementType.TYPE)
@Retention(RetentionPolicy.RUNTIME)
@Documented
public @interface OutboxHandler {

  /**
   * Message type routed to the bean.
   */
  String value();
}
