/**
 * Scheduled purge of terminal outbox messages to prevent table bloat.
 *
 * @see ddd.outbox.purge.OutboxPurgeScheduler
 */
package ddd.outbox.purge;
