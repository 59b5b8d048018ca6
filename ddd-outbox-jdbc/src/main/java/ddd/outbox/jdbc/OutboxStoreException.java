package ddd.outbox.jdbc;

/**
 * Unchecked exception wrapping JDBC and serialization errors raised by the JDBC repository.
 */
public final class OutboxStoreException extends RuntimeException {

  public OutboxStoreException(String message, Throwable cause) {
    super(message, cause);
  }
}
