/**
 * Retry scheduling for failed messages.
 *
 * <p>The processor leaves a failing message {@code FAILED}; the
 * {@link ddd.outbox.requeue.FailedMessageRequeuer} decides whether and when it becomes
 * {@code PENDING} again, using a {@link ddd.outbox.requeue.RetryPolicy}.
 */
package ddd.outbox.requeue;
