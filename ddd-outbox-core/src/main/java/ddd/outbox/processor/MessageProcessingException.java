package ddd.outbox.processor;

/**
 * Base class for failures reported by the message processor.
 *
 * <p>Store failures are not wrapped in this type; they propagate as thrown by the
 * {@link ddd.outbox.spi.OutboxRepository}.
 */
public class MessageProcessingException extends RuntimeException {

  public MessageProcessingException(String message) {
    super(message);
  }

  public MessageProcessingException(String message, Throwable cause) {
    super(message, cause);
  }
}
