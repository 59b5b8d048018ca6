package ddd.outbox.spring.boot;

import ddd.outbox.Outbox;
import org.springframework.context.SmartLifecycle;

import java.util.logging.Logger;

/**
 * Starts the {@link Outbox} once the context is refreshed and stops its schedules when the
 * context stops. The outbox itself is closed with its bean.
 */
public class OutboxLifecycle implements SmartLifecycle {
  private static final Logger logger = Logger.getLogger(OutboxLifecycle.class.getName());

  private final Outbox outbox;
  private final boolean autoStart;
  private volatile boolean running;

  public OutboxLifecycle(Outbox outbox, boolean autoStart) {
    this.outbox = outbox;
    this.autoStart = autoStart;
  }

  @Override
  public synchronized void start() {
    if (running) {
      return;
    }
    outbox.start();
    running = true;
    logger.info("Outbox processing started");
  }

  @Override
  public synchronized void stop() {
    if (!running) {
      return;
    }
    running = false;
    outbox.stop();
    logger.info("Outbox processing stopped");
  }

  @Override
  public boolean isRunning() {
    return running;
  }

  @Override
  public boolean isAutoStartup() {
    return autoStart;
  }
}
