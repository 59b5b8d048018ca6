/**
 * Root API of the outbox message processing engine.
 *
 * <h2>Core Design</h2>
 * <p>Producers record an {@link ddd.outbox.model.OutboxMessage} through an
 * {@link ddd.outbox.spi.OutboxRepository} as part of their business transaction. The
 * {@linkplain ddd.outbox.processor.StandardMessageProcessor processor} later fetches eligible
 * messages (status {@code PENDING}, {@code processAfter} reached) by priority tier and creation
 * time, routes each by {@code messageType} to one handler through the middleware pipeline, and
 * records {@code PROCESSED} or {@code FAILED}. Failed messages are retried only through the
 * {@linkplain ddd.outbox.requeue.FailedMessageRequeuer requeue sweep}. Delivery is
 * at-least-once; handlers must tolerate duplicates.
 *
 * <h2>Module Layout</h2>
 * <ul>
 *   <li><b>ddd-outbox-core</b>: model, SPI, processor, factory, requeue, purge, in-memory store</li>
 *   <li><b>ddd-outbox-jdbc</b>: JDBC repository (H2, MySQL, PostgreSQL)</li>
 *   <li><b>ddd-outbox-micrometer</b>: Micrometer metrics exporter</li>
 *   <li><b>ddd-outbox-spring-boot-starter</b>: auto-configuration and annotated handlers</li>
 * </ul>
 *
 * <h2>Quick Start</h2>
 * <pre>{@code
 * var repository = new InMemoryOutboxRepository();
 * var processor = StandardMessageProcessor.builder()
 *     .repository(repository)
 *     .build();
 * processor.registerHandler("OrderPlaced", message ->
 *     System.out.println("Received: " + message.payload()));
 *
 * repository.saveMessage(OutboxMessageFactory.createMessage("OrderPlaced", order));
 * processor.processMessages();
 * }</pre>
 *
 * @see ddd.outbox.Outbox
 * @see ddd.outbox.processor.StandardMessageProcessor
 * @see ddd.outbox.factory.OutboxMessageFactory
 */
package ddd.outbox;
