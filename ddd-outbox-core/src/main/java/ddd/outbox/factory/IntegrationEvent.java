package ddd.outbox.factory;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Minimal view of an integration event that can be recorded in the outbox.
 *
 * @param <T> payload type
 * @see OutboxMessageFactory#createFromIntegrationEvent
 */
public interface IntegrationEvent<T> {

  String eventType();

  T payload();

  /**
   * Event metadata such as correlation or tenant ids. Never {@code null}.
   */
  default Map<String, Object> metadata() {
    return Collections.emptyMap();
  }

  static <T> IntegrationEvent<T> of(String eventType, T payload) {
    return of(eventType, payload, Collections.emptyMap());
  }

  static <T> IntegrationEvent<T> of(String eventType, T payload, Map<String, ?> metadata) {
    Objects.requireNonNull(eventType, "eventType");
    Map<String, Object> copy = metadata == null || metadata.isEmpty()
        ? Collections.emptyMap()
        : Collections.unmodifiableMap(new LinkedHashMap<>(metadata));
    return new IntegrationEvent<>() {
      @Override
      public String eventType() {
        return eventType;
      }

      @Override
      public T payload() {
        return payload;
      }

      @Override
      public Map<String, Object> metadata() {
        return copy;
      }

      @Override
      public String toString() {
        return "IntegrationEvent{eventType=" + eventType + '}';
      }
    };
  }
}
