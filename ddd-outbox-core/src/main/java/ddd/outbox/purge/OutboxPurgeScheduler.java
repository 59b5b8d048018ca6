package ddd.outbox.purge;

import ddd.outbox.model.MessageStatus;
import ddd.outbox.spi.MetricsExporter;
import ddd.outbox.spi.OutboxRepository;
import ddd.outbox.util.DaemonThreadFactory;

import java.time.Duration;
import java.time.Instant;
import java.util.EnumSet;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Scheduled component that deletes terminal outbox messages older than a retention period.
 *
 * <p>Each cycle calls {@link OutboxRepository#deleteByStatusAndAge} once per configured
 * status ({@code PROCESSED} and {@code FAILED} by default). A failure for one status is
 * logged and does not prevent the others from being purged.
 *
 * <p>Create instances via {@link #builder()}.
 *
 * @see OutboxPurgeScheduler.Builder
 */
public final class OutboxPurgeScheduler implements AutoCloseable {
  private static final Logger logger = Logger.getLogger(OutboxPurgeScheduler.class.getName());

  private final OutboxRepository repository;
  private final Duration retention;
  private final Set<MessageStatus> statuses;
  private final long intervalSeconds;
  private final MetricsExporter metrics;

  private ScheduledExecutorService scheduler;
  private volatile ScheduledFuture<?> purgeTask;
  private volatile boolean closed;

  private OutboxPurgeScheduler(Builder builder) {
    this.repository = Objects.requireNonNull(builder.repository, "repository");
    if (builder.retention != null && builder.retention.isNegative()) {
      throw new IllegalArgumentException("retention must be >= 0");
    }
    if (builder.intervalSeconds <= 0L) {
      throw new IllegalArgumentException("intervalSeconds must be > 0");
    }
    if (builder.statuses.isEmpty()) {
      throw new IllegalArgumentException("statuses cannot be empty");
    }
    for (MessageStatus status : builder.statuses) {
      if (!status.isTerminal()) {
        throw new IllegalArgumentException("Only terminal statuses can be purged: " + status);
      }
    }
    this.retention = builder.retention != null ? builder.retention : Duration.ofDays(7);
    this.statuses = EnumSet.copyOf(builder.statuses);
    this.intervalSeconds = builder.intervalSeconds;
    this.metrics = builder.metrics != null ? builder.metrics : MetricsExporter.NOOP;
  }

  public static Builder builder() {
    return new Builder();
  }

  /**
   * Starts the scheduled purge loop. Subsequent calls are no-ops if already started. A
   * stopped scheduler can be started again; a closed one cannot.
   */
  public synchronized void start() {
    if (closed) {
      throw new IllegalStateException("OutboxPurgeScheduler has been closed");
    }
    if (purgeTask != null) {
      return;
    }
    scheduler = Executors.newSingleThreadScheduledExecutor(new DaemonThreadFactory("outbox-purge-"));
    purgeTask = scheduler.scheduleWithFixedDelay(
        this::runOnce, intervalSeconds, intervalSeconds, TimeUnit.SECONDS);
  }

  /**
   * Executes a single purge cycle. May be invoked directly for testing or one-off purges.
   *
   * @return total number of deleted messages
   */
  public int runOnce() {
    if (closed) {
      return 0;
    }
    Instant cutoff = Instant.now().minus(retention);
    int total = 0;
    for (MessageStatus status : statuses) {
      try {
        total += repository.deleteByStatusAndAge(cutoff, status);
      } catch (Throwable t) {
        logger.log(Level.SEVERE, "Purge of " + status + " messages failed", t);
      }
    }
    if (total > 0) {
      metrics.incrementPurged(total);
      logger.log(Level.INFO, "Purged {0} messages older than {1}", new Object[]{total, cutoff});
    }
    return total;
  }

  /** Cancels the purge schedule and shuts down the scheduler thread. */
  public synchronized void stop() {
    if (purgeTask != null) {
      purgeTask.cancel(false);
      purgeTask = null;
    }
    if (scheduler != null) {
      scheduler.shutdownNow();
      try {
        scheduler.awaitTermination(5, TimeUnit.SECONDS);
      } catch (InterruptedException e) {
        Thread.currentThread().interrupt();
      }
      scheduler = null;
    }
  }

  public synchronized boolean isRunning() {
    return purgeTask != null;
  }

  /** Stops the purge loop for good. */
  @Override
  public synchronized void close() {
    closed = true;
    stop();
  }

  /** Builder for {@link OutboxPurgeScheduler}. */
  public static final class Builder {
    private OutboxRepository repository;
    private Duration retention;
    private Set<MessageStatus> statuses = EnumSet.of(MessageStatus.PROCESSED, MessageStatus.FAILED);
    private long intervalSeconds = 3600;
    private MetricsExporter metrics;

    private Builder() {
    }

    /**
     * <p><b>Required.</b>
     *
     * @param repository the outbox repository
     * @return this builder
     */
    public Builder repository(OutboxRepository repository) {
      this.repository = repository;
      return this;
    }

    /**
     * Sets the retention period. Messages created before {@code now - retention} are deleted.
     *
     * <p>Optional. Defaults to {@code 7 days}. Must be &ge; 0.
     *
     * @param retention the retention duration
     * @return this builder
     */
    public Builder retention(Duration retention) {
      this.retention = retention;
      return this;
    }

    /**
     * Sets the statuses to purge.
     *
     * <p>Optional. Defaults to {@code PROCESSED} and {@code FAILED}. Only terminal statuses
     * are accepted.
     *
     * @param statuses the statuses to purge
     * @return this builder
     */
    public Builder statuses(Set<MessageStatus> statuses) {
      this.statuses = Objects.requireNonNull(statuses, "statuses");
      return this;
    }

    /**
     * Optional. Defaults to {@code 3600} (1 hour). Must be &gt; 0.
     *
     * @param intervalSeconds purge interval in seconds
     * @return this builder
     */
    public Builder intervalSeconds(long intervalSeconds) {
      this.intervalSeconds = intervalSeconds;
      return this;
    }

    /**
     * Optional. Defaults to {@link MetricsExporter#NOOP}.
     *
     * @param metrics the metrics exporter
     * @return this builder
     */
    public Builder metrics(MetricsExporter metrics) {
      this.metrics = metrics;
      return this;
    }

    /**
     * @throws NullPointerException     if {@code repository} is null
     * @throws IllegalArgumentException if {@code retention} is negative, {@code intervalSeconds <= 0},
     *                                  or a status is empty or not terminal
     */
    public OutboxPurgeScheduler build() {
      return new OutboxPurgeScheduler(this);
    }
  }
}
