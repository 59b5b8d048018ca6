package ddd.outbox.processor;

import ddd.outbox.util.DaemonThreadFactory;

import java.time.Duration;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Built-in middlewares.
 */
public final class Middlewares {
  private static final Logger logger = Logger.getLogger(Middlewares.class.getName());

  private Middlewares() {
  }

  /**
   * Bounds each delivery to {@code timeout}. The inner layers run on a daemon thread owned by
   * the returned middleware; when the timeout elapses that thread is interrupted and the
   * delivery fails with {@link DeliveryTimeoutException}. Idle threads exit after 60 seconds.
   *
   * @param timeout maximum delivery time, must be positive
   */
  public static OutboxMiddleware timeout(Duration timeout) {
    return timeout(timeout, Executors.newCachedThreadPool(new DaemonThreadFactory("outbox-delivery-")));
  }

  /**
   * Like {@link #timeout(Duration)}, running deliveries on {@code executor}. The caller owns
   * the executor and shuts it down.
   *
   * @param timeout  maximum delivery time, must be positive
   * @param executor runs the inner layers
   */
  public static OutboxMiddleware timeout(Duration timeout, ExecutorService executor) {
    Objects.requireNonNull(timeout, "timeout");
    Objects.requireNonNull(executor, "executor");
    if (timeout.isZero() || timeout.isNegative()) {
      throw new IllegalArgumentException("timeout must be positive");
    }
    long timeoutMs = timeout.toMillis();
    return next -> message -> {
      Future<Void> future = executor.submit(() -> {
        next.deliver(message);
        return null;
      });
      try {
        future.get(timeoutMs, TimeUnit.MILLISECONDS);
      } catch (TimeoutException e) {
        future.cancel(true);
        throw new DeliveryTimeoutException(message.id(), timeout);
      } catch (InterruptedException e) {
        future.cancel(true);
        Thread.currentThread().interrupt();
        throw e;
      } catch (ExecutionException e) {
        Throwable cause = e.getCause();
        if (cause instanceof Exception ex) {
          throw ex;
        }
        if (cause instanceof Error err) {
          throw err;
        }
        throw e;
      }
    };
  }

  /**
   * Logs the start (FINE), completion (FINE) and failure (WARNING) of each delivery
   * with its elapsed time.
   */
  public static OutboxMiddleware logging() {
    return next -> message -> {
      long start = System.nanoTime();
      logger.log(Level.FINE, "Delivering message {0} of type {1}",
          new Object[]{message.id(), message.messageType()});
      try {
        next.deliver(message);
      } catch (Exception e) {
        logger.log(Level.WARNING, "Delivery of message " + message.id() + " failed after "
            + elapsedMs(start) + " ms", e);
        throw e;
      }
      logger.log(Level.FINE, "Delivered message {0} in {1} ms",
          new Object[]{message.id(), elapsedMs(start)});
    };
  }

  /**
   * Folds {@code middlewares} right to left around {@code base}, so the first middleware
   * is the outermost layer.
   */
  public static MessageDelivery compose(List<OutboxMiddleware> middlewares, MessageDelivery base) {
    MessageDelivery delivery = base;
    for (int i = middlewares.size() - 1; i >= 0; i--) {
      delivery = middlewares.get(i).wrap(delivery);
    }
    return delivery;
  }

  private static long elapsedMs(long startNanos) {
    return TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - startNanos);
  }
}
