package ddd.outbox.processor;

import java.time.Duration;

/**
 * Raised by {@link Middlewares#timeout(Duration)} when a delivery does not finish in time.
 */
public final class DeliveryTimeoutException extends MessageProcessingException {

  public DeliveryTimeoutException(String messageId, Duration timeout) {
    super("Delivery of message " + messageId + " timed out after " + timeout.toMillis() + " ms");
  }
}
