package ddd.outbox.requeue;

import ddd.outbox.model.OutboxMessage;
import ddd.outbox.spi.MetricsExporter;
import ddd.outbox.spi.OutboxRepository;
import ddd.outbox.util.DaemonThreadFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Scheduled sweep that moves retryable {@code FAILED} messages back to {@code PENDING}.
 *
 * <p>A message is retryable while its attempt count is below {@code maxAttempts}. It is
 * requeued with {@code processAfter = now + retryPolicy.computeDelayMs(attempts)}, so the
 * processor picks it up again once the backoff has elapsed. Messages that reached
 * {@code maxAttempts} stay {@code FAILED} until purged or requeued by hand.
 *
 * <p>Each sweep first fails {@code PROCESSING} messages claimed more than
 * {@code stuckTimeout} ago, which a crashed or interrupted processor left behind, and then
 * requeues them with the other failures. {@code stuckTimeout} must exceed the longest
 * expected delivery, or slow deliveries may run twice.
 *
 * <p>Each sweep reads batches until one comes back short. Create instances via
 * {@link #builder()}.
 *
 * @see FailedMessageRequeuer.Builder
 * @see RetryPolicy
 */
public final class FailedMessageRequeuer implements AutoCloseable {
  private static final Logger logger = Logger.getLogger(FailedMessageRequeuer.class.getName());

  private final OutboxRepository repository;
  private final RetryPolicy retryPolicy;
  private final int maxAttempts;
  private final int batchSize;
  private final long intervalMs;
  private final Duration stuckTimeout;
  private final Clock clock;
  private final MetricsExporter metrics;

  private ScheduledExecutorService scheduler;
  private volatile ScheduledFuture<?> sweepTask;
  private volatile boolean closed;

  private FailedMessageRequeuer(Builder builder) {
    this.repository = Objects.requireNonNull(builder.repository, "repository");
    if (builder.maxAttempts <= 0) {
      throw new IllegalArgumentException("maxAttempts must be > 0");
    }
    if (builder.batchSize <= 0) {
      throw new IllegalArgumentException("batchSize must be > 0");
    }
    if (builder.intervalMs <= 0L) {
      throw new IllegalArgumentException("intervalMs must be > 0");
    }
    Objects.requireNonNull(builder.stuckTimeout, "stuckTimeout");
    if (builder.stuckTimeout.isZero() || builder.stuckTimeout.isNegative()) {
      throw new IllegalArgumentException("stuckTimeout must be positive");
    }
    this.retryPolicy = builder.retryPolicy != null ? builder.retryPolicy : new ExponentialBackoffRetryPolicy();
    this.maxAttempts = builder.maxAttempts;
    this.batchSize = builder.batchSize;
    this.intervalMs = builder.intervalMs;
    this.stuckTimeout = builder.stuckTimeout;
    this.clock = Objects.requireNonNull(builder.clock, "clock");
    this.metrics = builder.metrics != null ? builder.metrics : MetricsExporter.NOOP;
  }

  public static Builder builder() {
    return new Builder();
  }

  /**
   * Starts the scheduled sweep. Subsequent calls are no-ops if already started. A stopped
   * requeuer can be started again; a closed one cannot.
   */
  public synchronized void start() {
    if (closed) {
      throw new IllegalStateException("FailedMessageRequeuer has been closed");
    }
    if (sweepTask != null) {
      return;
    }
    scheduler = Executors.newSingleThreadScheduledExecutor(new DaemonThreadFactory("outbox-requeue-"));
    sweepTask = scheduler.scheduleWithFixedDelay(this::sweep, intervalMs, intervalMs, TimeUnit.MILLISECONDS);
  }

  /**
   * Runs one sweep. May be invoked directly for testing or one-off requeues.
   *
   * @return number of messages moved back to {@code PENDING}
   */
  public int runOnce() {
    if (closed) {
      return 0;
    }
    int stuck = repository.failStuckMessages(clock.instant().minus(stuckTimeout),
        "Processing did not complete within " + stuckTimeout);
    if (stuck > 0) {
      logger.log(Level.WARNING, "Failed {0} messages stuck in PROCESSING", stuck);
    }
    int total = 0;
    List<OutboxMessage<?>> batch;
    int requeued;
    do {
      batch = repository.getFailedMessages(batchSize, maxAttempts);
      requeued = 0;
      Instant now = clock.instant();
      for (OutboxMessage<?> message : batch) {
        Instant processAfter = now.plusMillis(retryPolicy.computeDelayMs(Math.max(1, message.attempts())));
        if (repository.requeue(message.id(), processAfter)) {
          requeued++;
        }
      }
      total += requeued;
    } while (batch.size() >= batchSize && requeued > 0);
    if (total > 0) {
      metrics.incrementRequeued(total);
      logger.log(Level.INFO, "Requeued {0} failed messages", total);
    }
    return total;
  }

  private void sweep() {
    try {
      runOnce();
    } catch (Throwable t) {
      logger.log(Level.SEVERE, "Requeue sweep failed", t);
    }
  }

  /** Cancels the sweep schedule and shuts down the scheduler thread. */
  public synchronized void stop() {
    if (sweepTask != null) {
      sweepTask.cancel(false);
      sweepTask = null;
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
    return sweepTask != null;
  }

  /** Stops the sweep for good. */
  @Override
  public synchronized void close() {
    closed = true;
    stop();
  }

  /** Builder for {@link FailedMessageRequeuer}. */
  public static final class Builder {
    private OutboxRepository repository;
    private RetryPolicy retryPolicy;
    private int maxAttempts = 10;
    private int batchSize = 100;
    private long intervalMs = 30_000;
    private Duration stuckTimeout = Duration.ofMinutes(5);
    private Clock clock = Clock.systemUTC();
    private MetricsExporter metrics;

    private Builder() {
    }

    /**
     * <b>Required.</b>
     *
     * @param repository the outbox repository
     * @return this builder
     */
    public Builder repository(OutboxRepository repository) {
      this.repository = repository;
      return this;
    }

    /**
     * Sets the backoff applied to requeued messages.
     *
     * <p>Optional. Defaults to {@link ExponentialBackoffRetryPolicy} (200 ms base, 60 s cap).
     *
     * @param retryPolicy the retry policy
     * @return this builder
     */
    public Builder retryPolicy(RetryPolicy retryPolicy) {
      this.retryPolicy = retryPolicy;
      return this;
    }

    /**
     * Sets the attempt count at which a message is no longer requeued.
     *
     * <p>Optional. Defaults to {@code 10}. Must be &gt; 0.
     *
     * @param maxAttempts max delivery attempts per message
     * @return this builder
     */
    public Builder maxAttempts(int maxAttempts) {
      this.maxAttempts = maxAttempts;
      return this;
    }

    /**
     * Optional. Defaults to {@code 100}. Must be &gt; 0.
     *
     * @param batchSize max messages read per batch
     * @return this builder
     */
    public Builder batchSize(int batchSize) {
      this.batchSize = batchSize;
      return this;
    }

    /**
     * Optional. Defaults to {@code 30000} ms. Must be &gt; 0.
     *
     * @param intervalMs sweep interval in milliseconds
     * @return this builder
     */
    public Builder intervalMs(long intervalMs) {
      this.intervalMs = intervalMs;
      return this;
    }

    /**
     * Sets how long a message may stay {@code PROCESSING} before the sweep fails it.
     *
     * <p>Optional. Defaults to 5 minutes. Must be positive.
     *
     * @param stuckTimeout max time between claim and outcome
     * @return this builder
     */
    public Builder stuckTimeout(Duration stuckTimeout) {
      this.stuckTimeout = stuckTimeout;
      return this;
    }

    /**
     * Optional. Defaults to {@link Clock#systemUTC()}.
     *
     * @param clock source of the current time for backoff and stuck detection
     * @return this builder
     */
    public Builder clock(Clock clock) {
      this.clock = clock;
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
     * @throws IllegalArgumentException if {@code maxAttempts}, {@code batchSize},
     *                                  {@code intervalMs} or {@code stuckTimeout} is not
     *                                  positive
     */
    public FailedMessageRequeuer build() {
      return new FailedMessageRequeuer(this);
    }
  }
}
