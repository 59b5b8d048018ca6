package ddd.outbox.processor;

/**
 * Thrown when a message's type has no registered handler.
 */
public final class HandlerNotFoundException extends MessageProcessingException {
  private final String messageType;

  public HandlerNotFoundException(String messageType) {
    super("No handler registered for message type: " + messageType);
    this.messageType = messageType;
  }

  public String messageType() {
    return messageType;
  }
}
