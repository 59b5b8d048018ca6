/**
 * Micrometer bridge for {@link ddd.outbox.spi.MetricsExporter}.
 */
package ddd.outbox.micrometer;
