package ddd.outbox.micrometer;

import ddd.outbox.memory.InMemoryOutboxRepository;
import ddd.outbox.factory.OutboxMessageFactory;
import ddd.outbox.processor.StandardMessageProcessor;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.DistributionSummary;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class MicrometerMetricsExporterTest {

  private SimpleMeterRegistry registry;
  private MicrometerMetricsExporter exporter;

  @BeforeEach
  void setUp() {
    registry = new SimpleMeterRegistry();
    exporter = new MicrometerMetricsExporter(registry);
  }

  @Test
  void incrementProcessed() {
    exporter.incrementProcessed();
    exporter.incrementProcessed();
    assertEquals(2.0, counter("outbox.processed").count());
  }

  @Test
  void incrementFailedAndHandlerMissing() {
    exporter.incrementFailed();
    exporter.incrementHandlerNotFound();
    assertEquals(1.0, counter("outbox.failed").count());
    assertEquals(1.0, counter("outbox.handler.missing").count());
  }

  @Test
  void requeuedAndPurgedAddCounts() {
    exporter.incrementRequeued(3);
    exporter.incrementPurged(5);
    exporter.incrementPurged(2);
    assertEquals(3.0, counter("outbox.requeued").count());
    assertEquals(7.0, counter("outbox.purged").count());
  }

  @Test
  void recordBatchSize() {
    exporter.recordBatchSize(10);
    exporter.recordBatchSize(0);

    DistributionSummary summary = summary("outbox.batch.size");
    assertEquals(2, summary.count());
    assertEquals(10.0, summary.totalAmount());
    assertEquals(10.0, summary.max());
  }

  @Test
  void recordHandlerDuration() {
    exporter.recordHandlerDurationMs(25);
    assertEquals(25.0, summary("outbox.handler.duration.ms").totalAmount());
  }

  @Test
  void customPrefix() {
    SimpleMeterRegistry custom = new SimpleMeterRegistry();
    MicrometerMetricsExporter prefixed = new MicrometerMetricsExporter(custom, "orders.outbox");
    prefixed.incrementProcessed();
    assertEquals(1.0, custom.find("orders.outbox.processed").counter().count());
    assertNull(custom.find("outbox.processed").counter());
  }

  @Test
  void rejectsInvalidPrefix() {
    assertThrows(NullPointerException.class, () -> new MicrometerMetricsExporter(registry, null));
    assertThrows(IllegalArgumentException.class, () -> new MicrometerMetricsExporter(registry, ""));
    assertThrows(IllegalArgumentException.class, () -> new MicrometerMetricsExporter(registry, "outbox."));
  }

  @Test
  void closeRemovesMetersAndIgnoresLaterCalls() {
    exporter.close();

    assertNull(registry.find("outbox.processed").counter());
    assertNull(registry.find("outbox.batch.size").summary());
    exporter.incrementProcessed();
    exporter.recordBatchSize(3);
    assertTrue(registry.getMeters().isEmpty());
  }

  @Test
  void processorReportsThroughExporter() {
    InMemoryOutboxRepository repository = new InMemoryOutboxRepository();
    repository.saveMessage(OutboxMessageFactory.createMessage("OrderPlaced", "o-1"));
    repository.saveMessage(OutboxMessageFactory.createMessage("Unrouted", "o-2"));

    try (StandardMessageProcessor processor = StandardMessageProcessor.builder()
        .repository(repository)
        .metrics(exporter)
        .build()) {
      processor.registerHandler("OrderPlaced", message -> { });
      processor.processMessages();
    }

    assertEquals(1.0, counter("outbox.processed").count());
    assertEquals(1.0, counter("outbox.failed").count());
    assertEquals(1.0, counter("outbox.handler.missing").count());
    assertEquals(2.0, summary("outbox.batch.size").totalAmount());
    assertEquals(1, summary("outbox.handler.duration.ms").count());
  }

  private Counter counter(String name) {
    Counter c = registry.find(name).counter();
    assertNotNull(c, "counter " + name + " not registered");
    return c;
  }

  private DistributionSummary summary(String name) {
    DistributionSummary s = registry.find(name).summary();
    assertNotNull(s, "summary " + name + " not registered");
    return s;
  }
}
