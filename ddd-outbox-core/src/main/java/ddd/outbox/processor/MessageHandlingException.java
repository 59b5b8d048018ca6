package ddd.outbox.processor;

/**
 * Thrown when a handler or a middleware fails while delivering a message.
 * The original failure is the {@linkplain #getCause() cause}.
 */
public final class MessageHandlingException extends MessageProcessingException {
  private final String messageId;
  private final String messageType;

  public MessageHandlingException(String messageId, String messageType, Throwable cause) {
    super("Failed to process message " + messageId + " of type " + messageType, cause);
    this.messageId = messageId;
    this.messageType = messageType;
  }

  public String messageId() {
    return messageId;
  }

  public String messageType() {
    return messageType;
  }
}
