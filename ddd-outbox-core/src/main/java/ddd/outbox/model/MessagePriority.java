package ddd.outbox.model;

import java.util.List;
import java.util.Locale;

/**
 * Delivery priority tier of an outbox message.
 *
 * <p>The {@link #value() value} is the lowercase wire name ({@code "low"}, {@code "normal"},
 * {@code "high"}, {@code "critical"}); the {@link #code() code} is the numeric form used by
 * JDBC stores.
 */
public enum MessagePriority {
  LOW(0),
  NORMAL(1),
  HIGH(2),
  CRITICAL(3);

  /**
   * Default fetch order: most urgent tier first.
   */
  public static final List<MessagePriority> DEFAULT_ORDER = List.of(CRITICAL, HIGH, NORMAL, LOW);

  private final int code;

  MessagePriority(int code) {
    this.code = code;
  }

  public int code() {
    return code;
  }

  public String value() {
    return name().toLowerCase(Locale.ROOT);
  }

  public static MessagePriority fromCode(int code) {
    for (MessagePriority priority : values()) {
      if (priority.code == code) {
        return priority;
      }
    }
    throw new IllegalArgumentException("Unknown message priority code: " + code);
  }

  /**
   * Parses the wire name, case-insensitively.
   *
   * @throws IllegalArgumentException if the value names no priority
   */
  public static MessagePriority fromValue(String value) {
    for (MessagePriority priority : values()) {
      if (priority.name().equalsIgnoreCase(value)) {
        return priority;
      }
    }
    throw new IllegalArgumentException("Unknown message priority: " + value);
  }
}
