package ddd.outbox.jdbc;

import java.util.Map;

/**
 * Converts message payloads and metadata to and from the text stored in the outbox table.
 *
 * @see JacksonPayloadCodec
 */
public interface PayloadCodec {

  String encodePayload(Object payload);

  /**
   * Decodes a stored payload. The message type lets implementations pick a target class.
   *
   * @param messageType the stored message type
   * @param json        the stored payload, may be {@code null}
   */
  Object decodePayload(String messageType, String json);

  String encodeMetadata(Map<String, Object> metadata);

  Map<String, Object> decodeMetadata(String json);
}
