package ddd.outbox.requeue;

import java.util.concurrent.ThreadLocalRandom;

/**
 * Exponential backoff with jitter: {@code baseDelay * 2^(attempts-1)}, capped at
 * {@code maxDelay}, multiplied by a random factor in [0.5, 1.5) and capped again.
 */
public final class ExponentialBackoffRetryPolicy implements RetryPolicy {
  public static final long DEFAULT_BASE_DELAY_MS = 200L;
  public static final long DEFAULT_MAX_DELAY_MS = 60_000L;

  private final long baseDelayMs;
  private final long maxDelayMs;

  public ExponentialBackoffRetryPolicy() {
    this(DEFAULT_BASE_DELAY_MS, DEFAULT_MAX_DELAY_MS);
  }

  /**
   * @param baseDelayMs delay before the first retry (milliseconds), must be &gt; 0
   * @param maxDelayMs  upper bound for any delay (milliseconds), must be &ge; baseDelayMs
   */
  public ExponentialBackoffRetryPolicy(long baseDelayMs, long maxDelayMs) {
    if (baseDelayMs <= 0) {
      throw new IllegalArgumentException("baseDelayMs must be > 0, got: " + baseDelayMs);
    }
    if (maxDelayMs < baseDelayMs) {
      throw new IllegalArgumentException("maxDelayMs must be >= baseDelayMs, got: " + maxDelayMs);
    }
    this.baseDelayMs = baseDelayMs;
    this.maxDelayMs = maxDelayMs;
  }

  @Override
  public long computeDelayMs(int attempts) {
    if (attempts <= 0) {
      return 0L;
    }
    long exponential = maxDelayMs;
    if (attempts < 63) {
      long factor = 1L << (attempts - 1);
      // overflow guard
      if (factor <= maxDelayMs / baseDelayMs) {
        exponential = baseDelayMs * factor;
      }
    }
    long capped = Math.min(maxDelayMs, exponential);
    double jitter = ThreadLocalRandom.current().nextDouble(0.5, 1.5);
    return Math.min(maxDelayMs, Math.max(0L, (long) (capped * jitter)));
  }

  public long baseDelayMs() {
    return baseDelayMs;
  }

  public long maxDelayMs() {
    return maxDelayMs;
  }
}
