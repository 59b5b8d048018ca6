package ddd.outbox.spi;

/**
 * Observability hook for exporting message processing counters to a metrics backend.
 *
 * <p>The {@link #NOOP} instance discards all metrics silently. Implement this interface
 * to bridge into Micrometer, Prometheus, or other monitoring systems.
 */
public interface MetricsExporter {

  /**
   * No-op instance that discards all metrics.
   */
  MetricsExporter NOOP = new Noop();

  /**
   * Increments the count of messages delivered successfully.
   */
  void incrementProcessed();

  /**
   * Increments the count of messages whose delivery failed.
   */
  void incrementFailed();

  /**
   * Increments the count of messages with no registered handler.
   */
  default void incrementHandlerNotFound() {
  }

  /**
   * Records the number of messages fetched by one batch run.
   */
  void recordBatchSize(int size);

  /**
   * Records the time spent in the middleware-wrapped handler for one message.
   *
   * @param durationMs elapsed milliseconds (always non-negative)
   */
  default void recordHandlerDurationMs(long durationMs) {
  }

  /**
   * Increments the count of {@code FAILED} messages moved back to {@code PENDING}.
   */
  default void incrementRequeued(int count) {
  }

  /**
   * Increments the count of purged messages.
   */
  default void incrementPurged(int count) {
  }

  /**
   * Default no-op implementation that discards all metrics.
   */
  final class Noop implements MetricsExporter {
    @Override
    public void incrementProcessed() {
    }

    @Override
    public void incrementFailed() {
    }

    @Override
    public void recordBatchSize(int size) {
    }
  }
}
