package ddd.outbox.requeue;

/**
 * Computes how long a {@code FAILED} message waits before it becomes eligible again.
 *
 * @see ExponentialBackoffRetryPolicy
 */
@FunctionalInterface
public interface RetryPolicy {

  /**
   * @param attempts failed attempts so far (1-based)
   * @return delay in milliseconds (non-negative)
   */
  long computeDelayMs(int attempts);
}
