package ddd.outbox.model;

/**
 * Lifecycle status of an outbox message.
 *
 * <p>{@code PENDING} is the only initial state. The processor moves a message to
 * {@code PROCESSING} when it selects it and then to {@code PROCESSED} or {@code FAILED}.
 * A {@code FAILED} message only returns to {@code PENDING} through an explicit requeue.
 */
public enum MessageStatus {
  PENDING(0),
  PROCESSING(1),
  PROCESSED(2),
  FAILED(3);

  private final int code;

  MessageStatus(int code) {
    this.code = code;
  }

  public int code() {
    return code;
  }

  /**
   * Returns {@code true} for statuses the processor never leaves on its own.
   */
  public boolean isTerminal() {
    return this == PROCESSED || this == FAILED;
  }

  public static MessageStatus fromCode(int code) {
    for (MessageStatus status : values()) {
      if (status.code == code) {
        return status;
      }
    }
    throw new IllegalArgumentException("Unknown message status code: " + code);
  }
}
