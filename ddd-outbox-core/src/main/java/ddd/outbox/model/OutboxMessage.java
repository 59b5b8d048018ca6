package ddd.outbox.model;

import com.github.f4b6a3.ulid.UlidCreator;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Immutable snapshot of an outbox message.
 *
 * <p>Each message is assigned a ULID-based {@code id} by default. The {@code payload} and
 * {@code metadata} are opaque to the processor; only the handler registered for
 * {@link #messageType()} interprets them. Stores hand out snapshots, so status changes are
 * made through the repository and never by mutating an instance.
 *
 * @param <T> payload type
 * @see ddd.outbox.factory.OutboxMessageFactory
 */
public final class OutboxMessage<T> {
  private final String id;
  private final String messageType;
  private final T payload;
  private final Map<String, Object> metadata;
  private final MessageStatus status;
  private final int attempts;
  private final Instant createdAt;
  private final Instant processAfter;
  private final MessagePriority priority;
  private final String lastError;

  private OutboxMessage(Builder<T> builder) {
    this.id = builder.id == null ? newId() : builder.id;
    if (this.id.isEmpty()) {
      throw new IllegalArgumentException("id cannot be empty");
    }
    this.messageType = Objects.requireNonNull(builder.messageType, "messageType");
    if (this.messageType.isEmpty()) {
      throw new IllegalArgumentException("messageType cannot be empty");
    }
    if (builder.attempts < 0) {
      throw new IllegalArgumentException("attempts must be >= 0");
    }
    this.payload = builder.payload;
    this.metadata = builder.metadata == null
        ? Collections.emptyMap()
        : Collections.unmodifiableMap(new LinkedHashMap<>(builder.metadata));
    if (this.metadata.containsKey(null)) {
      throw new IllegalArgumentException("metadata cannot contain null keys");
    }
    this.status = builder.status == null ? MessageStatus.PENDING : builder.status;
    this.attempts = builder.attempts;
    this.createdAt = builder.createdAt == null ? Instant.now() : builder.createdAt;
    this.processAfter = builder.processAfter;
    this.priority = builder.priority == null ? MessagePriority.NORMAL : builder.priority;
    this.lastError = builder.lastError;
  }

  /**
   * Creates a builder for a new {@code PENDING} message.
   *
   * @param messageType routing key used to look up the handler
   * @param payload     the message body, may be {@code null}
   * @param <T>         payload type
   * @return a new builder
   */
  public static <T> Builder<T> builder(String messageType, T payload) {
    return new Builder<T>().messageType(messageType).payload(payload);
  }

  /**
   * Returns a builder initialized with every field of this message, including its id.
   */
  public Builder<T> toBuilder() {
    Builder<T> builder = new Builder<>();
    builder.id = id;
    builder.messageType = messageType;
    builder.payload = payload;
    builder.metadata = metadata;
    builder.status = status;
    builder.attempts = attempts;
    builder.createdAt = createdAt;
    builder.processAfter = processAfter;
    builder.priority = priority;
    builder.lastError = lastError;
    return builder;
  }

  public static String newId() {
    return UlidCreator.getMonotonicUlid().toString();
  }

  public String id() {
    return id;
  }

  public String messageType() {
    return messageType;
  }

  public T payload() {
    return payload;
  }

  public Map<String, Object> metadata() {
    return metadata;
  }

  public MessageStatus status() {
    return status;
  }

  public int attempts() {
    return attempts;
  }

  public Instant createdAt() {
    return createdAt;
  }

  /**
   * Earliest instant at which the message may be selected, or {@code null} for immediately.
   */
  public Instant processAfter() {
    return processAfter;
  }

  public MessagePriority priority() {
    return priority;
  }

  public String lastError() {
    return lastError;
  }

  /**
   * Returns {@code true} if this message is {@code PENDING} and its
   * {@code processAfter} is absent or not after {@code now}.
   */
  public boolean isEligibleAt(Instant now) {
    return status == MessageStatus.PENDING
        && (processAfter == null || !processAfter.isAfter(now));
  }

  @Override
  public String toString() {
    return "OutboxMessage{id=" + id
        + ", messageType=" + messageType
        + ", status=" + status
        + ", priority=" + priority
        + ", attempts=" + attempts
        + ", createdAt=" + createdAt
        + ", processAfter=" + processAfter
        + '}';
  }

  /**
   * Builder for {@link OutboxMessage}.
   *
   * @param <T> payload type
   */
  public static final class Builder<T> {
    private String id;
    private String messageType;
    private T payload;
    private Map<String, Object> metadata;
    private MessageStatus status;
    private int attempts;
    private Instant createdAt;
    private Instant processAfter;
    private MessagePriority priority;
    private String lastError;

    private Builder() {
    }

    /**
     * Optional. Defaults to a new ULID.
     */
    public Builder<T> id(String id) {
      this.id = id;
      return this;
    }

    /**
     * <b>Required.</b> Must be non-empty.
     */
    public Builder<T> messageType(String messageType) {
      this.messageType = messageType;
      return this;
    }

    public Builder<T> payload(T payload) {
      this.payload = payload;
      return this;
    }

    /**
     * Optional. The map is copied; {@code null} keys are rejected.
     */
    public Builder<T> metadata(Map<String, ?> metadata) {
      this.metadata = metadata == null ? null : new LinkedHashMap<>(metadata);
      return this;
    }

    /**
     * Adds a single metadata entry.
     */
    public Builder<T> metadata(String key, Object value) {
      Objects.requireNonNull(key, "key");
      if (this.metadata == null) {
        this.metadata = new LinkedHashMap<>();
      } else if (!(this.metadata instanceof LinkedHashMap)) {
        this.metadata = new LinkedHashMap<>(this.metadata);
      }
      this.metadata.put(key, value);
      return this;
    }

    /**
     * Optional. Defaults to {@link MessageStatus#PENDING}.
     */
    public Builder<T> status(MessageStatus status) {
      this.status = status;
      return this;
    }

    /**
     * Optional. Defaults to {@code 0}. Must be &ge; 0.
     */
    public Builder<T> attempts(int attempts) {
      this.attempts = attempts;
      return this;
    }

    /**
     * Optional. Defaults to {@link Instant#now()} at build time.
     */
    public Builder<T> createdAt(Instant createdAt) {
      this.createdAt = createdAt;
      return this;
    }

    /**
     * Optional. {@code null} means eligible immediately.
     */
    public Builder<T> processAfter(Instant processAfter) {
      this.processAfter = processAfter;
      return this;
    }

    /**
     * Optional. Defaults to {@link MessagePriority#NORMAL}.
     */
    public Builder<T> priority(MessagePriority priority) {
      this.priority = priority;
      return this;
    }

    public Builder<T> lastError(String lastError) {
      this.lastError = lastError;
      return this;
    }

    /**
     * @throws NullPointerException     if {@code messageType} is null
     * @throws IllegalArgumentException if {@code messageType} or {@code id} is empty,
     *                                  or {@code attempts} is negative
     */
    public OutboxMessage<T> build() {
      return new OutboxMessage<>(this);
    }
  }
}
