package ddd.outbox.model;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Optional settings applied when a message is created through
 * {@link ddd.outbox.factory.OutboxMessageFactory}.
 */
public final class OutboxMessageOptions {

  /**
   * Options with nothing set.
   */
  public static final OutboxMessageOptions NONE = builder().build();

  private final Instant processAfter;
  private final MessagePriority priority;
  private final Map<String, Object> metadata;

  private OutboxMessageOptions(Builder builder) {
    this.processAfter = builder.processAfter;
    this.priority = builder.priority;
    this.metadata = builder.metadata.isEmpty()
        ? Collections.emptyMap()
        : Collections.unmodifiableMap(new LinkedHashMap<>(builder.metadata));
  }

  public static Builder builder() {
    return new Builder();
  }

  public Instant processAfter() {
    return processAfter;
  }

  /**
   * The requested priority, or {@code null} to keep the default.
   */
  public MessagePriority priority() {
    return priority;
  }

  public Map<String, Object> metadata() {
    return metadata;
  }

  public static final class Builder {
    private Instant processAfter;
    private MessagePriority priority;
    private final Map<String, Object> metadata = new LinkedHashMap<>();

    private Builder() {
    }

    public Builder processAfter(Instant processAfter) {
      this.processAfter = processAfter;
      return this;
    }

    public Builder priority(MessagePriority priority) {
      this.priority = priority;
      return this;
    }

    public Builder metadata(Map<String, ?> metadata) {
      if (metadata != null) {
        this.metadata.putAll(metadata);
      }
      return this;
    }

    public Builder metadata(String key, Object value) {
      this.metadata.put(key, value);
      return this;
    }

    public OutboxMessageOptions build() {
      return new OutboxMessageOptions(this);
    }
  }
}
