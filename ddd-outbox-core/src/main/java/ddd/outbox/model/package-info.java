/**
 * Message record model: the immutable {@link ddd.outbox.model.OutboxMessage} snapshot,
 * its lifecycle {@link ddd.outbox.model.MessageStatus status} and
 * {@link ddd.outbox.model.MessagePriority priority} tier.
 */
package ddd.outbox.model;
