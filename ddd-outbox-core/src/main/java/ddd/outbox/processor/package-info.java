/**
 * The message processor and its middleware pipeline.
 *
 * <p>{@link ddd.outbox.processor.StandardMessageProcessor} fetches eligible messages from the
 * {@link ddd.outbox.spi.OutboxRepository}, marks each {@code PROCESSING}, delivers it through
 * the {@link ddd.outbox.processor.OutboxMiddleware middlewares} to the handler registered for
 * its type, and records {@code PROCESSED} or {@code FAILED}.
 *
 * @see ddd.outbox.processor.StandardMessageProcessor
 * @see ddd.outbox.processor.Middlewares
 */
package ddd.outbox.processor;
