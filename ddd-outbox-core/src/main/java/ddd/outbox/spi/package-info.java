/**
 * Service provider interfaces implemented outside the core.
 *
 * <ul>
 *   <li>{@link ddd.outbox.spi.OutboxRepository}: message persistence and status transitions</li>
 *   <li>{@link ddd.outbox.spi.MetricsExporter}: counters and timings</li>
 * </ul>
 */
package ddd.outbox.spi;
