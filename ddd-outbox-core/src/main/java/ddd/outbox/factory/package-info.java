/**
 * Side-effect-free helpers for building new outbox messages, including the
 * {@code integration_event:<eventType>} naming convention.
 */
package ddd.outbox.factory;
