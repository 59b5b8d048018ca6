package ddd.outbox.micrometer;

import ddd.outbox.spi.MetricsExporter;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.DistributionSummary;
import io.micrometer.core.instrument.Meter;
import io.micrometer.core.instrument.MeterRegistry;

import java.util.List;
import java.util.Objects;

/**
 * Micrometer-based implementation of {@link MetricsExporter}.
 *
 * <h3>Counters</h3>
 * <ul>
 *   <li>{@code outbox.processed}: messages delivered successfully</li>
 *   <li>{@code outbox.failed}: messages whose delivery failed</li>
 *   <li>{@code outbox.handler.missing}: messages with no registered handler</li>
 *   <li>{@code outbox.requeued}: failed messages moved back to pending</li>
 *   <li>{@code outbox.purged}: terminal messages deleted by retention</li>
 * </ul>
 *
 * <h3>Distribution summaries</h3>
 * <ul>
 *   <li>{@code outbox.batch.size}: messages fetched per batch run</li>
 *   <li>{@code outbox.handler.duration.ms}: handler time per message</li>
 * </ul>
 *
 * @see MetricsExporter
 */
public final class MicrometerMetricsExporter implements MetricsExporter, AutoCloseable {

  private final MeterRegistry registry;
  private final Counter processed;
  private final Counter failed;
  private final Counter handlerMissing;
  private final Counter requeued;
  private final Counter purged;
  private final DistributionSummary batchSize;
  private final DistributionSummary handlerDuration;
  private volatile boolean closed;

  /**
   * Creates an exporter with the default metric name prefix {@code "outbox"}.
   *
   * @param registry the Micrometer meter registry
   */
  public MicrometerMetricsExporter(MeterRegistry registry) {
    this(registry, "outbox");
  }

  /**
   * Creates an exporter with a custom metric name prefix, for several processors
   * sharing one registry.
   *
   * @param registry   the Micrometer meter registry
   * @param namePrefix prefix for all meter names (e.g. {@code "orders.outbox"})
   */
  public MicrometerMetricsExporter(MeterRegistry registry, String namePrefix) {
    Objects.requireNonNull(registry, "registry");
    Objects.requireNonNull(namePrefix, "namePrefix");
    if (namePrefix.isEmpty()) {
      throw new IllegalArgumentException("namePrefix must not be empty");
    }
    if (namePrefix.endsWith(".")) {
      throw new IllegalArgumentException("namePrefix must not end with '.'");
    }

    this.registry = registry;
    this.processed = Counter.builder(namePrefix + ".processed")
        .description("Messages delivered successfully")
        .register(registry);
    this.failed = Counter.builder(namePrefix + ".failed")
        .description("Messages whose delivery failed")
        .register(registry);
    this.handlerMissing = Counter.builder(namePrefix + ".handler.missing")
        .description("Messages with no registered handler")
        .register(registry);
    this.requeued = Counter.builder(namePrefix + ".requeued")
        .description("Failed messages moved back to pending")
        .register(registry);
    this.purged = Counter.builder(namePrefix + ".purged")
        .description("Terminal messages deleted by retention")
        .register(registry);
    this.batchSize = DistributionSummary.builder(namePrefix + ".batch.size")
        .description("Messages fetched per batch run")
        .register(registry);
    this.handlerDuration = DistributionSummary.builder(namePrefix + ".handler.duration.ms")
        .description("Handler time per message")
        .baseUnit("milliseconds")
        .register(registry);
  }

  @Override
  public void incrementProcessed() {
    if (closed) return;
    processed.increment();
  }

  @Override
  public void incrementFailed() {
    if (closed) return;
    failed.increment();
  }

  @Override
  public void incrementHandlerNotFound() {
    if (closed) return;
    handlerMissing.increment();
  }

  @Override
  public void recordBatchSize(int size) {
    if (closed) return;
    batchSize.record(size);
  }

  @Override
  public void recordHandlerDurationMs(long durationMs) {
    if (closed) return;
    handlerDuration.record(durationMs);
  }

  @Override
  public void incrementRequeued(int count) {
    if (closed) return;
    requeued.increment(count);
  }

  @Override
  public void incrementPurged(int count) {
    if (closed) return;
    purged.increment(count);
  }

  /**
   * Removes all meters registered by this exporter from the registry. Later calls to the
   * recording methods are ignored.
   */
  @Override
  public void close() {
    closed = true;
    RuntimeException first = null;
    for (Meter meter : List.of(processed, failed, handlerMissing, requeued, purged,
        batchSize, handlerDuration)) {
      try {
        registry.remove(meter);
      } catch (RuntimeException e) {
        if (first == null) first = e; else first.addSuppressed(e);
      }
    }
    if (first != null) throw first;
  }
}
