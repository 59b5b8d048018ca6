package ddd.outbox;

import ddd.outbox.handler.DefaultHandlerRegistry;
import ddd.outbox.handler.OutboxMessageHandler;
import ddd.outbox.model.MessagePriority;
import ddd.outbox.processor.OutboxMiddleware;
import ddd.outbox.processor.StandardMessageProcessor;
import ddd.outbox.purge.OutboxPurgeScheduler;
import ddd.outbox.requeue.FailedMessageRequeuer;
import ddd.outbox.requeue.RetryPolicy;
import ddd.outbox.spi.MetricsExporter;
import ddd.outbox.spi.OutboxRepository;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Composite entry point that wires a {@link StandardMessageProcessor}, an optional
 * {@link FailedMessageRequeuer} and an optional {@link OutboxPurgeScheduler} over one
 * {@link OutboxRepository} into a single {@link AutoCloseable} unit.
 *
 * <h2>Example</h2>
 * <pre>{@code
 * try (Outbox outbox = Outbox.builder()
 *     .repository(repository)
 *     .handler("OrderPlaced", message -> publisher.publish(message))
 *     .requeue(10, new ExponentialBackoffRetryPolicy())
 *     .purge(Duration.ofDays(7))
 *     .build()) {
 *   outbox.start();
 *   // record messages through the repository inside business transactions...
 * }
 * }</pre>
 *
 * @see StandardMessageProcessor
 * @see FailedMessageRequeuer
 * @see OutboxPurgeScheduler
 */
public final class Outbox implements AutoCloseable {

  private final StandardMessageProcessor processor;
  private final FailedMessageRequeuer requeuer;
  private final OutboxPurgeScheduler purgeScheduler;
  private final MetricsExporter metrics;

  private Outbox(StandardMessageProcessor processor, FailedMessageRequeuer requeuer,
      OutboxPurgeScheduler purgeScheduler, MetricsExporter metrics) {
    this.processor = processor;
    this.requeuer = requeuer;
    this.purgeScheduler = purgeScheduler;
    this.metrics = metrics;
  }

  public static Builder builder() {
    return new Builder();
  }

  public StandardMessageProcessor processor() {
    return processor;
  }

  /**
   * Returns the requeue sweep, or {@code null} if requeueing is disabled.
   */
  public FailedMessageRequeuer requeuer() {
    return requeuer;
  }

  /**
   * Returns the purge scheduler, or {@code null} if purging is disabled.
   */
  public OutboxPurgeScheduler purgeScheduler() {
    return purgeScheduler;
  }

  /**
   * Starts continuous processing and the optional requeue and purge schedules.
   * Repeated calls are no-ops, and a stopped outbox can be started again.
   */
  public synchronized void start() {
    processor.startProcessing();
    if (requeuer != null) {
      requeuer.start();
    }
    if (purgeScheduler != null) {
      purgeScheduler.start();
    }
  }

  public boolean isRunning() {
    return processor.isRunning();
  }

  /**
   * Stops the schedules started by {@link #start()} and keeps the components open, so
   * {@link #start()} may be called again.
   */
  public synchronized void stop() {
    if (purgeScheduler != null) {
      purgeScheduler.stop();
    }
    if (requeuer != null) {
      requeuer.stop();
    }
    processor.stopProcessing();
  }

  /**
   * Shuts down components in order: purge scheduler, requeuer, processor.
   * Absent components are skipped.
   */
  @Override
  public void close() {
    RuntimeException first = null;
    if (purgeScheduler != null) {
      try {
        purgeScheduler.close();
      } catch (RuntimeException e) {
        first = e;
      }
    }
    if (requeuer != null) {
      try {
        requeuer.close();
      } catch (RuntimeException e) {
        if (first == null) first = e; else first.addSuppressed(e);
      }
    }
    try {
      processor.close();
    } catch (RuntimeException e) {
      if (first == null) first = e; else first.addSuppressed(e);
    }
    if (metrics instanceof AutoCloseable closeable) {
      try {
        closeable.close();
      } catch (Exception e) {
        RuntimeException re = (e instanceof RuntimeException r) ? r : new RuntimeException(e);
        if (first == null) first = re; else first.addSuppressed(re);
      }
    }
    if (first != null) {
      throw first;
    }
  }

  /** Builder for {@link Outbox}. */
  public static final class Builder {
    private OutboxRepository repository;
    private DefaultHandlerRegistry handlerRegistry;
    private final List<OutboxMiddleware> middlewares = new ArrayList<>();
    private MetricsExporter metrics;
    private int batchSize = 100;
    private long intervalMs = 5000;
    private List<MessagePriority> priorityOrder;
    private boolean requeueEnabled;
    private int maxAttempts = 10;
    private RetryPolicy retryPolicy;
    private long requeueIntervalMs = 30_000;
    private Duration stuckTimeout = Duration.ofMinutes(5);
    private boolean purgeEnabled;
    private Duration purgeRetention;
    private long purgeIntervalSeconds = 3600;
    private final AtomicBoolean built = new AtomicBoolean(false);

    private Builder() {
    }

    /**
     * <p><b>Required.</b>
     */
    public Builder repository(OutboxRepository repository) {
      this.repository = repository;
      return this;
    }

    /**
     * Optional. Defaults to a new {@link DefaultHandlerRegistry}.
     */
    public Builder handlerRegistry(DefaultHandlerRegistry handlerRegistry) {
      this.handlerRegistry = handlerRegistry;
      return this;
    }

    /**
     * Registers a handler in the handler registry.
     */
    public Builder handler(String messageType, OutboxMessageHandler<?> handler) {
      if (handlerRegistry == null) {
        handlerRegistry = new DefaultHandlerRegistry();
      }
      handlerRegistry.register(messageType, handler);
      return this;
    }

    public Builder middleware(OutboxMiddleware middleware) {
      middlewares.add(Objects.requireNonNull(middleware, "middleware"));
      return this;
    }

    /**
     * Optional. Defaults to {@link MetricsExporter#NOOP}. Closed with the outbox when it
     * implements {@link AutoCloseable}.
     */
    public Builder metrics(MetricsExporter metrics) {
      this.metrics = metrics;
      return this;
    }

    /**
     * Optional. Defaults to {@code 100}.
     */
    public Builder batchSize(int batchSize) {
      this.batchSize = batchSize;
      return this;
    }

    /**
     * Optional. Defaults to {@code 5000} ms.
     */
    public Builder intervalMs(long intervalMs) {
      this.intervalMs = intervalMs;
      return this;
    }

    public Builder priorityOrder(List<MessagePriority> priorityOrder) {
      this.priorityOrder = priorityOrder;
      return this;
    }

    /**
     * Enables the requeue sweep.
     *
     * @param maxAttempts attempt count at which a message stays {@code FAILED}
     * @param retryPolicy backoff for requeued messages, {@code null} for the default
     */
    public Builder requeue(int maxAttempts, RetryPolicy retryPolicy) {
      this.requeueEnabled = true;
      this.maxAttempts = maxAttempts;
      this.retryPolicy = retryPolicy;
      return this;
    }

    /**
     * Optional. Defaults to {@code 30000} ms.
     */
    public Builder requeueIntervalMs(long requeueIntervalMs) {
      this.requeueIntervalMs = requeueIntervalMs;
      return this;
    }

    /**
     * Optional. Defaults to 5 minutes.
     *
     * @see FailedMessageRequeuer.Builder#stuckTimeout(Duration)
     */
    public Builder stuckTimeout(Duration stuckTimeout) {
      this.stuckTimeout = stuckTimeout;
      return this;
    }

    /**
     * Enables the purge scheduler for {@code PROCESSED} and {@code FAILED} messages.
     *
     * @param retention age after which terminal messages are deleted
     */
    public Builder purge(Duration retention) {
      this.purgeEnabled = true;
      this.purgeRetention = retention;
      return this;
    }

    /**
     * Optional. Defaults to {@code 3600} seconds.
     */
    public Builder purgeIntervalSeconds(long purgeIntervalSeconds) {
      this.purgeIntervalSeconds = purgeIntervalSeconds;
      return this;
    }

    /**
     * @throws NullPointerException     if {@code repository} is null
     * @throws IllegalArgumentException if a component setting is invalid
     * @throws IllegalStateException    if called twice
     */
    public Outbox build() {
      if (!built.compareAndSet(false, true)) {
        throw new IllegalStateException("build() already called on this builder");
      }
      Objects.requireNonNull(repository, "repository");
      MetricsExporter effectiveMetrics = metrics != null ? metrics : MetricsExporter.NOOP;

      StandardMessageProcessor processor = StandardMessageProcessor.builder()
          .repository(repository)
          .handlerRegistry(handlerRegistry)
          .middlewares(middlewares)
          .defaultBatchSize(batchSize)
          .intervalMs(intervalMs)
          .priorityOrder(priorityOrder)
          .metrics(effectiveMetrics)
          .build();

      FailedMessageRequeuer requeuer = null;
      if (requeueEnabled) {
        requeuer = FailedMessageRequeuer.builder()
            .repository(repository)
            .maxAttempts(maxAttempts)
            .retryPolicy(retryPolicy)
            .batchSize(batchSize)
            .intervalMs(requeueIntervalMs)
            .stuckTimeout(stuckTimeout)
            .metrics(effectiveMetrics)
            .build();
      }

      OutboxPurgeScheduler purgeScheduler = null;
      if (purgeEnabled) {
        purgeScheduler = OutboxPurgeScheduler.builder()
            .repository(repository)
            .retention(purgeRetention)
            .intervalSeconds(purgeIntervalSeconds)
            .metrics(effectiveMetrics)
            .build();
      }
      return new Outbox(processor, requeuer, purgeScheduler, effectiveMetrics);
    }
  }
}
