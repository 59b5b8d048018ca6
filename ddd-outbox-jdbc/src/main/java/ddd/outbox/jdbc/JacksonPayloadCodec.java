package ddd.outbox.jdbc;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * {@link PayloadCodec} backed by Jackson.
 *
 * <p>Payloads of message types registered with {@link Builder#payloadType} are read back as
 * that class. Other payloads are read as plain JSON values ({@link Map}, {@link java.util.List},
 * {@link String}, {@link Number}, {@link Boolean}).
 *
 * <pre>{@code
 * PayloadCodec codec = JacksonPayloadCodec.builder()
 *     .payloadType("OrderPlaced", OrderPlaced.class)
 *     .build();
 * }</pre>
 */
public final class JacksonPayloadCodec implements PayloadCodec {
  private static final TypeReference<Map<String, Object>> METADATA_TYPE = new TypeReference<>() {};

  private final ObjectMapper objectMapper;
  private final Map<String, Class<?>> payloadTypes;

  private JacksonPayloadCodec(Builder builder) {
    this.objectMapper = builder.objectMapper != null ? builder.objectMapper : defaultObjectMapper();
    this.payloadTypes = Map.copyOf(builder.payloadTypes);
  }

  /**
   * Returns a codec with a default {@link ObjectMapper} and no registered payload types.
   */
  public static JacksonPayloadCodec create() {
    return builder().build();
  }

  public static Builder builder() {
    return new Builder();
  }

  /**
   * Returns the mapper used when none is supplied: Java time support, ISO-8601 dates.
   */
  public static ObjectMapper defaultObjectMapper() {
    return new ObjectMapper()
        .registerModule(new JavaTimeModule())
        .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
  }

  @Override
  public String encodePayload(Object payload) {
    if (payload == null) {
      return null;
    }
    try {
      return objectMapper.writeValueAsString(payload);
    } catch (JsonProcessingException e) {
      throw new OutboxStoreException("Failed to serialize payload of type " + payload.getClass().getName(), e);
    }
  }

  @Override
  public Object decodePayload(String messageType, String json) {
    if (json == null) {
      return null;
    }
    Class<?> target = payloadTypes.getOrDefault(messageType, Object.class);
    try {
      return objectMapper.readValue(json, target);
    } catch (JsonProcessingException e) {
      throw new OutboxStoreException("Failed to deserialize payload of message type " + messageType, e);
    }
  }

  @Override
  public String encodeMetadata(Map<String, Object> metadata) {
    if (metadata == null || metadata.isEmpty()) {
      return null;
    }
    try {
      return objectMapper.writeValueAsString(metadata);
    } catch (JsonProcessingException e) {
      throw new OutboxStoreException("Failed to serialize metadata", e);
    }
  }

  @Override
  public Map<String, Object> decodeMetadata(String json) {
    if (json == null || json.isEmpty()) {
      return Collections.emptyMap();
    }
    try {
      return objectMapper.readValue(json, METADATA_TYPE);
    } catch (JsonProcessingException e) {
      throw new OutboxStoreException("Failed to deserialize metadata", e);
    }
  }

  /** Builder for {@link JacksonPayloadCodec}. */
  public static final class Builder {
    private ObjectMapper objectMapper;
    private final Map<String, Class<?>> payloadTypes = new LinkedHashMap<>();

    private Builder() {
    }

    /**
     * Optional. Defaults to {@link #defaultObjectMapper()}.
     */
    public Builder objectMapper(ObjectMapper objectMapper) {
      this.objectMapper = objectMapper;
      return this;
    }

    /**
     * Reads payloads of {@code messageType} back as {@code payloadClass}.
     */
    public Builder payloadType(String messageType, Class<?> payloadClass) {
      payloadTypes.put(Objects.requireNonNull(messageType, "messageType"),
          Objects.requireNonNull(payloadClass, "payloadClass"));
      return this;
    }

    public JacksonPayloadCodec build() {
      return new JacksonPayloadCodec(this);
    }
  }
}
