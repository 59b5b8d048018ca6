package ddd.outbox;

import ddd.outbox.factory.OutboxMessageFactory;
import ddd.outbox.memory.InMemoryOutboxRepository;
import ddd.outbox.model.MessageStatus;
import ddd.outbox.model.OutboxMessage;
import ddd.outbox.spi.MetricsExporter;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.concurrent.atomic.AtomicBoolean;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class OutboxTest {

  private final InMemoryOutboxRepository repository = new InMemoryOutboxRepository();

  @Test
  void optionalComponentsAbsentByDefault() {
    try (Outbox outbox = Outbox.builder().repository(repository).build()) {
      assertNotNull(outbox.processor());
      assertNull(outbox.requeuer());
      assertNull(outbox.purgeScheduler());
    }
  }

  @Test
  void startedOutboxDeliversAndRetries() throws Exception {
    AtomicBoolean failOnce = new AtomicBoolean(true);
    try (Outbox outbox = Outbox.builder()
        .repository(repository)
        .handler("OrderPlaced", message -> {
          if (failOnce.getAndSet(false)) {
            throw new IllegalStateException("transient");
          }
        })
        .intervalMs(20)
        .requeue(3, attempts -> 0L)
        .requeueIntervalMs(20)
        .purge(Duration.ofDays(7))
        .build()) {
      OutboxMessage<String> message = OutboxMessageFactory.createMessage("OrderPlaced", "order-1");
      repository.saveMessage(message);

      outbox.start();
      outbox.start();
      assertTrue(outbox.isRunning());

      long deadline = System.currentTimeMillis() + 5000;
      while (repository.getById(message.id()).orElseThrow().status() != MessageStatus.PROCESSED
          && System.currentTimeMillis() < deadline) {
        Thread.sleep(10);
      }
      OutboxMessage<?> stored = repository.getById(message.id()).orElseThrow();
      assertEquals(MessageStatus.PROCESSED, stored.status());
      assertEquals(1, stored.attempts());
    }
  }

  @Test
  void closeStopsEverythingAndClosesMetrics() {
    AtomicBoolean metricsClosed = new AtomicBoolean();
    Outbox outbox = Outbox.builder()
        .repository(repository)
        .metrics(new ClosableMetrics(metricsClosed))
        .requeue(3, null)
        .purge(Duration.ofDays(1))
        .build();
    outbox.start();

    outbox.close();

    assertFalse(outbox.isRunning());
    assertTrue(metricsClosed.get());
    assertThrows(IllegalStateException.class, outbox::start);
  }

  @Test
  void stoppedOutboxCanBeStartedAgain() {
    try (Outbox outbox = Outbox.builder()
        .repository(repository)
        .requeue(3, null)
        .purge(Duration.ofDays(1))
        .build()) {
      outbox.start();

      outbox.stop();
      assertFalse(outbox.isRunning());
      assertFalse(outbox.requeuer().isRunning());
      assertFalse(outbox.purgeScheduler().isRunning());

      outbox.start();
      assertTrue(outbox.isRunning());
      assertTrue(outbox.requeuer().isRunning());
      assertTrue(outbox.purgeScheduler().isRunning());
    }
  }

  @Test
  void builderCannotBeReused() {
    Outbox.Builder builder = Outbox.builder().repository(repository);
    builder.build().close();
    assertThrows(IllegalStateException.class, builder::build);
  }

  @Test
  void builderRequiresRepository() {
    assertThrows(NullPointerException.class, () -> Outbox.builder().build());
  }

  private static final class ClosableMetrics implements MetricsExporter, AutoCloseable {
    private final AtomicBoolean closed;

    ClosableMetrics(AtomicBoolean closed) {
      this.closed = closed;
    }

    @Override
    public void incrementProcessed() {
    }

    @Override
    public void incrementFailed() {
    }

    @Override
    public void recordBatchSize(int size) {
    }

    @Override
    public void close() {
      closed.set(true);
    }
  }
}
