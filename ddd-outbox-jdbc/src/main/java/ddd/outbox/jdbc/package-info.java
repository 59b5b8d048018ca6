/**
 * JDBC implementation of {@link ddd.outbox.spi.OutboxRepository}.
 *
 * <p>{@link ddd.outbox.jdbc.JdbcOutboxRepository} stores messages in an {@code outbox_message}
 * table using a dialect-specific {@link ddd.outbox.jdbc.store.AbstractJdbcOutboxStore}.
 * Table definitions for H2, MySQL and PostgreSQL ship on the classpath under
 * {@code ddd/outbox/jdbc/schema/}.
 */
package ddd.outbox.jdbc;
