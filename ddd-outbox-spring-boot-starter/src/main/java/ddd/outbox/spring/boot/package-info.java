/**
 * Spring Boot auto-configuration for the outbox message processor.
 *
 * <p>With a {@code DataSource} on the context, the starter provides a JDBC-backed
 * {@link ddd.outbox.spi.OutboxRepository} that joins Spring transactions, registers beans
 * annotated with {@link ddd.outbox.spring.boot.OutboxHandler} or
 * {@link ddd.outbox.spring.boot.IntegrationEventHandler}, and runs an {@link ddd.outbox.Outbox}
 * configured under {@code ddd.outbox.*}.
 */
package ddd.outbox.spring.boot;
