package ddd.outbox.processor;

import ddd.outbox.handler.OutboxMessageHandler;
import ddd.outbox.model.OutboxMessage;

import java.time.Duration;

/**
 * Delivers outbox messages to their handlers and records the outcome in the repository.
 *
 * <p>Handlers and middlewares are registered during setup, before
 * {@link #startProcessing()}; registering while running is rejected.
 *
 * @see StandardMessageProcessor
 */
public interface MessageProcessor extends AutoCloseable {

  /**
   * Registers the handler for a message type, replacing any previous one.
   *
   * @throws IllegalStateException if processing is running
   */
  MessageProcessor registerHandler(String messageType, OutboxMessageHandler<?> handler);

  /**
   * Appends a middleware to the delivery pipeline.
   *
   * @throws IllegalStateException if processing is running
   */
  MessageProcessor use(OutboxMiddleware middleware);

  /**
   * Prepares the processor. Called implicitly by {@link #startProcessing()};
   * repeated calls are no-ops.
   */
  void initialize();

  /**
   * Delivers one message. On success the message becomes {@code PROCESSED}; on failure its
   * attempts are incremented, it becomes {@code FAILED} with the failure recorded, and the
   * failure is thrown.
   *
   * @throws HandlerNotFoundException if no handler is registered for the message type
   * @throws MessageHandlingException if the handler or a middleware fails
   */
  void processMessage(OutboxMessage<?> message);

  /**
   * Processes one batch of the default size.
   *
   * @return number of messages delivered successfully
   */
  int processMessages();

  /**
   * Fetches up to {@code batchSize} eligible messages and delivers them one at a time in
   * store order. A failing message does not stop the rest of the batch.
   *
   * @return number of messages delivered successfully
   */
  int processMessages(int batchSize);

  /**
   * Starts continuous processing at the default interval. No-op if already running.
   */
  void startProcessing();

  /**
   * Starts continuous processing, running one batch per {@code interval}.
   * No-op if already running.
   */
  void startProcessing(Duration interval);

  /**
   * Stops continuous processing. A batch already running is allowed to finish.
   * No-op if not running.
   */
  void stopProcessing();

  boolean isRunning();

  /**
   * Stops processing and releases the scheduler thread. The processor cannot be restarted.
   */
  @Override
  void close();
}
