package ddd.outbox.processor;

import ddd.outbox.handler.DefaultHandlerRegistry;
import ddd.outbox.handler.OutboxMessageHandler;
import ddd.outbox.model.MessagePriority;
import ddd.outbox.model.MessageStatus;
import ddd.outbox.model.OutboxMessage;
import ddd.outbox.spi.MetricsExporter;
import ddd.outbox.spi.OutboxRepository;
import ddd.outbox.util.DaemonThreadFactory;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.locks.ReentrantLock;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Default {@link MessageProcessor}: routes each message by type to one handler through
 * the middleware pipeline and records the outcome through the {@link OutboxRepository}.
 *
 * <h2>Continuous processing</h2>
 * <p>{@link #startProcessing(Duration)} runs {@link #processMessages()} on a single daemon
 * thread with fixed-delay scheduling: the next run starts {@code interval} after the previous
 * one finished, so scheduled runs never overlap. A failing run is logged and the schedule
 * continues. If a run is still in flight when the processor is stopped and restarted, the
 * new schedule skips its runs until the old one completes.
 *
 * <p>Create instances via {@link #builder()}.
 *
 * <h2>Example</h2>
 * <pre>{@code
 * StandardMessageProcessor processor = StandardMessageProcessor.builder()
 *     .repository(repository)
 *     .defaultBatchSize(100)
 *     .interval(Duration.ofSeconds(5))
 *     .build();
 * processor.registerHandler("OrderPlaced", message -> publisher.publish(message));
 * processor.use(Middlewares.timeout(Duration.ofSeconds(30)));
 * processor.startProcessing();
 * }</pre>
 *
 * @see StandardMessageProcessor.Builder
 */
public final class StandardMessageProcessor implements MessageProcessor {
  private static final Logger logger = Logger.getLogger(StandardMessageProcessor.class.getName());

  private final OutboxRepository repository;
  private final DefaultHandlerRegistry handlers;
  private final List<OutboxMiddleware> middlewares;
  private final int defaultBatchSize;
  private final long intervalMs;
  private final List<MessagePriority> priorityOrder;
  private final MetricsExporter metrics;
  private final ReentrantLock runLock = new ReentrantLock();

  private ScheduledExecutorService scheduler;
  private ScheduledFuture<?> processTask;
  private volatile boolean running;
  private volatile boolean initialized;
  private volatile boolean closed;

  private StandardMessageProcessor(Builder builder) {
    this.repository = Objects.requireNonNull(builder.repository, "repository");
    if (builder.defaultBatchSize <= 0) {
      throw new IllegalArgumentException("defaultBatchSize must be > 0");
    }
    if (builder.intervalMs <= 0L) {
      throw new IllegalArgumentException("intervalMs must be > 0");
    }
    if (builder.priorityOrder != null && builder.priorityOrder.isEmpty()) {
      throw new IllegalArgumentException("priorityOrder cannot be empty");
    }
    this.handlers = builder.handlers != null ? builder.handlers : new DefaultHandlerRegistry();
    this.middlewares = new CopyOnWriteArrayList<>(builder.middlewares);
    this.defaultBatchSize = builder.defaultBatchSize;
    this.intervalMs = builder.intervalMs;
    this.priorityOrder = builder.priorityOrder != null
        ? List.copyOf(builder.priorityOrder) : MessagePriority.DEFAULT_ORDER;
    this.metrics = builder.metrics != null ? builder.metrics : MetricsExporter.NOOP;
  }

  public static Builder builder() {
    return new Builder();
  }

  @Override
  public StandardMessageProcessor registerHandler(String messageType, OutboxMessageHandler<?> handler) {
    requireNotRunning("register a handler");
    handlers.register(messageType, handler);
    return this;
  }

  @Override
  public StandardMessageProcessor use(OutboxMiddleware middleware) {
    Objects.requireNonNull(middleware, "middleware");
    requireNotRunning("add a middleware");
    middlewares.add(middleware);
    return this;
  }

  @Override
  public synchronized void initialize() {
    if (initialized) {
      return;
    }
    initialized = true;
    logger.log(Level.INFO, "Message processor initialized with handlers for {0}",
        handlers.messageTypes());
  }

  @Override
  public void processMessage(OutboxMessage<?> message) {
    Objects.requireNonNull(message, "message");
    long start = System.nanoTime();
    try {
      OutboxMessageHandler<?> handler = handlers.handlerFor(message.messageType());
      if (handler == null) {
        throw new HandlerNotFoundException(message.messageType());
      }
      Middlewares.compose(middlewares, m -> invoke(handler, m)).deliver(message);
    } catch (HandlerNotFoundException e) {
      metrics.incrementHandlerNotFound();
      recordFailure(message, e);
      throw e;
    } catch (Throwable t) {
      if (t instanceof InterruptedException) {
        Thread.currentThread().interrupt();
      }
      metrics.recordHandlerDurationMs(elapsedMs(start));
      recordFailure(message, t);
      throw new MessageHandlingException(message.id(), message.messageType(), t);
    }
    metrics.recordHandlerDurationMs(elapsedMs(start));
    repository.updateStatus(message.id(), MessageStatus.PROCESSED);
    metrics.incrementProcessed();
  }

  @Override
  public int processMessages() {
    return processMessages(defaultBatchSize);
  }

  @Override
  public int processMessages(int batchSize) {
    if (batchSize <= 0) {
      throw new IllegalArgumentException("batchSize must be > 0");
    }
    List<OutboxMessage<?>> batch = repository.getUnprocessedMessages(batchSize, priorityOrder);
    metrics.recordBatchSize(batch.size());
    if (batch.isEmpty()) {
      return 0;
    }
    int processed = 0;
    for (OutboxMessage<?> message : batch) {
      try {
        repository.updateStatus(message.id(), MessageStatus.PROCESSING);
        processMessage(message.toBuilder().status(MessageStatus.PROCESSING).build());
        processed++;
      } catch (MessageProcessingException e) {
        logger.log(Level.WARNING, "Failed to process message " + message.id(), e);
      } catch (RuntimeException e) {
        logger.log(Level.SEVERE, "Store failure while processing message " + message.id(), e);
      } catch (Error e) {
        logger.log(Level.SEVERE, "Error while processing message " + message.id(), e);
      }
    }
    logger.log(Level.FINE, "Processed {0} of {1} messages", new Object[]{processed, batch.size()});
    return processed;
  }

  @Override
  public void startProcessing() {
    startProcessing(Duration.ofMillis(intervalMs));
  }

  @Override
  public synchronized void startProcessing(Duration interval) {
    Objects.requireNonNull(interval, "interval");
    if (closed) {
      throw new IllegalStateException("StandardMessageProcessor has been closed");
    }
    if (running) {
      return;
    }
    long periodMs = interval.toMillis();
    if (periodMs <= 0L) {
      throw new IllegalArgumentException("interval must be >= 1 ms");
    }
    initialize();
    scheduler = Executors.newSingleThreadScheduledExecutor(new DaemonThreadFactory("outbox-processor-"));
    processTask = scheduler.scheduleWithFixedDelay(this::runScheduled, periodMs, periodMs, TimeUnit.MILLISECONDS);
    running = true;
    logger.log(Level.INFO, "Started message processing every {0} ms", periodMs);
  }

  @Override
  public synchronized void stopProcessing() {
    if (!running) {
      return;
    }
    running = false;
    processTask.cancel(false);
    processTask = null;
    scheduler.shutdown();
    logger.log(Level.INFO, "Stopped message processing");
  }

  @Override
  public boolean isRunning() {
    return running;
  }

  @Override
  public synchronized void close() {
    ScheduledExecutorService current = scheduler;
    stopProcessing();
    closed = true;
    if (current != null) {
      try {
        if (!current.awaitTermination(5, TimeUnit.SECONDS)) {
          current.shutdownNow();
        }
      } catch (InterruptedException e) {
        current.shutdownNow();
        Thread.currentThread().interrupt();
      }
    }
  }

  /**
   * Returns a snapshot of the registered middlewares, outermost first.
   */
  public List<OutboxMiddleware> middlewares() {
    return new ArrayList<>(middlewares);
  }

  public DefaultHandlerRegistry handlerRegistry() {
    return handlers;
  }

  private void runScheduled() {
    if (!runLock.tryLock()) {
      logger.log(Level.FINE, "Previous processing run still in flight, skipping");
      return;
    }
    try {
      processMessages();
    } catch (Throwable t) {
      logger.log(Level.SEVERE, "Processing run failed", t);
    } finally {
      runLock.unlock();
    }
  }

  private void recordFailure(OutboxMessage<?> message, Throwable failure) {
    metrics.incrementFailed();
    try {
      repository.incrementAttempt(message.id());
      repository.updateStatus(message.id(), MessageStatus.FAILED, describe(failure));
    } catch (RuntimeException storeFailure) {
      storeFailure.addSuppressed(failure);
      throw storeFailure;
    }
  }

  private void requireNotRunning(String action) {
    if (running) {
      throw new IllegalStateException("Cannot " + action + " while processing is running");
    }
  }

  @SuppressWarnings("unchecked")
  private static void invoke(OutboxMessageHandler<?> handler, OutboxMessage<?> message) throws Exception {
    ((OutboxMessageHandler<Object>) handler).handle((OutboxMessage<Object>) message);
  }

  private static String describe(Throwable failure) {
    String text = failure.getMessage();
    return text == null || text.isEmpty() ? failure.getClass().getName() : text;
  }

  private static long elapsedMs(long startNanos) {
    return TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - startNanos);
  }

  /**
   * Builder for {@link StandardMessageProcessor}.
   */
  public static final class Builder {
    private OutboxRepository repository;
    private DefaultHandlerRegistry handlers;
    private final List<OutboxMiddleware> middlewares = new ArrayList<>();
    private int defaultBatchSize = 100;
    private long intervalMs = 5000;
    private List<MessagePriority> priorityOrder;
    private MetricsExporter metrics;

    private Builder() {
    }

    /**
     * Sets the repository used to fetch messages and record status transitions.
     *
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
     * Sets the registry that maps message types to handlers. Handlers registered through
     * {@link StandardMessageProcessor#registerHandler} are added to it.
     *
     * <p>Optional. Defaults to a new empty {@link DefaultHandlerRegistry}.
     *
     * @param handlers the handler registry
     * @return this builder
     */
    public Builder handlerRegistry(DefaultHandlerRegistry handlers) {
      this.handlers = handlers;
      return this;
    }

    /**
     * Appends a middleware. Middlewares run in the order they are added, outermost first.
     *
     * @param middleware the middleware to add
     * @return this builder
     */
    public Builder middleware(OutboxMiddleware middleware) {
      this.middlewares.add(Objects.requireNonNull(middleware, "middleware"));
      return this;
    }

    /**
     * Appends several middlewares.
     *
     * @param middlewares the middlewares to add, outermost first
     * @return this builder
     */
    public Builder middlewares(List<OutboxMiddleware> middlewares) {
      middlewares.forEach(this::middleware);
      return this;
    }

    /**
     * Sets the batch size used by {@link StandardMessageProcessor#processMessages()} and
     * scheduled runs.
     *
     * <p>Optional. Defaults to {@code 100}. Must be &gt; 0.
     *
     * @param defaultBatchSize max messages per run
     * @return this builder
     */
    public Builder defaultBatchSize(int defaultBatchSize) {
      this.defaultBatchSize = defaultBatchSize;
      return this;
    }

    /**
     * Sets the default interval between scheduled runs.
     *
     * <p>Optional. Defaults to {@code 5000} ms. Must be &gt; 0.
     *
     * @param intervalMs interval in milliseconds
     * @return this builder
     */
    public Builder intervalMs(long intervalMs) {
      this.intervalMs = intervalMs;
      return this;
    }

    /**
     * Same as {@link #intervalMs(long)} with a {@link Duration}.
     */
    public Builder interval(Duration interval) {
      return intervalMs(Objects.requireNonNull(interval, "interval").toMillis());
    }

    /**
     * Sets the priority order passed to the repository when fetching a batch.
     *
     * <p>Optional. Defaults to {@link MessagePriority#DEFAULT_ORDER}.
     *
     * @param priorityOrder priorities, most urgent first
     * @return this builder
     */
    public Builder priorityOrder(List<MessagePriority> priorityOrder) {
      this.priorityOrder = priorityOrder;
      return this;
    }

    /**
     * Sets the metrics exporter.
     *
     * <p>Optional. Defaults to {@link MetricsExporter#NOOP}.
     *
     * @param metrics the metrics exporter
     * @return this builder
     */
    public Builder metrics(MetricsExporter metrics) {
      this.metrics = metrics;
      return this;
    }

    /**
     * Builds the processor. Call {@link StandardMessageProcessor#startProcessing()} to begin
     * continuous processing.
     *
     * @return a new {@link StandardMessageProcessor}
     * @throws NullPointerException     if {@code repository} is null
     * @throws IllegalArgumentException if {@code defaultBatchSize <= 0}, {@code intervalMs <= 0}
     *                                  or {@code priorityOrder} is empty
     */
    public StandardMessageProcessor build() {
      return new StandardMessageProcessor(this);
    }
  }
}
