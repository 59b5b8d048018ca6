package ddd.outbox.spring.boot;

import java.lang.annotation.Documented;
import java.lang.annotation.ElementType;
import java.lang.annotation.Retention;
import java.lang.annotation.RetentionPolicy;
import java.lang.annotation.Target;

/**
 * Marks a Spring bean as the handler for an integration event. The bean is registered under
 * {@code integration_event:<eventType>}, the message type that
 * {@link ddd.outbox.factory.OutboxMessageFactory#createFromIntegrationEvent} produces.
 *
 * @see OutboxHandlerRegistrar
 */
@Target(ElementType.TYPE)
@Retention(RetentionPolicy.RUNTIME)
@Documented
public @interface IntegrationEventHandler {

  /**
   * Event type, without the {@code integration_event:} prefix.
   */
  String value();
}
