package ddd.outbox.spring.boot;

import ddd.outbox.jdbc.TableNames;
import ddd.outbox.model.MessagePriority;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

/**
 * Configuration properties for the outbox message processor.
 *
 * <pre>{@code
 * ddd.outbox.processor.interval=2s
 * ddd.outbox.processor.priority-order=critical,high,normal,low
 * ddd.outbox.requeue.enabled=true
 * ddd.outbox.requeue.max-attempts=5
 * ddd.outbox.purge.enabled=true
 * ddd.outbox.purge.retention=3d
 * }</pre>
 */
@ConfigurationProperties(prefix = "ddd.outbox")
public class OutboxProperties {

  private String tableName = TableNames.DEFAULT_TABLE;
  private Processor processor = new Processor();
  private Requeue requeue = new Requeue();
  private Purge purge = new Purge();
  private Metrics metrics = new Metrics();

  public String getTableName() { return tableName; }
  public void setTableName(String tableName) { this.tableName = tableName; }

  public Processor getProcessor() { return processor; }
  public void setProcessor(Processor processor) { this.processor = processor; }

  public Requeue getRequeue() { return requeue; }
  public void setRequeue(Requeue requeue) { this.requeue = requeue; }

  public Purge getPurge() { return purge; }
  public void setPurge(Purge purge) { this.purge = purge; }

  public Metrics getMetrics() { return metrics; }
  public void setMetrics(Metrics metrics) { this.metrics = metrics; }

  public static class Processor {
    private int defaultBatchSize = 100;
    private Duration interval = Duration.ofSeconds(5);
    private boolean autoStart = true;
    private List<MessagePriority> priorityOrder = new ArrayList<>(MessagePriority.DEFAULT_ORDER);
    /** Per-delivery timeout; unset means deliveries are not bounded. */
    private Duration handlerTimeout;
    private boolean logDeliveries;

    public int getDefaultBatchSize() { return defaultBatchSize; }
    public void setDefaultBatchSize(int defaultBatchSize) { this.defaultBatchSize = defaultBatchSize; }

    public Duration getInterval() { return interval; }
    public void setInterval(Duration interval) { this.interval = interval; }

    public boolean isAutoStart() { return autoStart; }
    public void setAutoStart(boolean autoStart) { this.autoStart = autoStart; }

    public List<MessagePriority> getPriorityOrder() { return priorityOrder; }
    public void setPriorityOrder(List<MessagePriority> priorityOrder) { this.priorityOrder = priorityOrder; }

    public Duration getHandlerTimeout() { return handlerTimeout; }
    public void setHandlerTimeout(Duration handlerTimeout) { this.handlerTimeout = handlerTimeout; }

    public boolean isLogDeliveries() { return logDeliveries; }
    public void setLogDeliveries(boolean logDeliveries) { this.logDeliveries = logDeliveries; }
  }

  public static class Requeue {
    private boolean enabled;
    private int maxAttempts = 10;
    private int batchSize = 100;
    private Duration interval = Duration.ofSeconds(30);
    private Duration baseDelay = Duration.ofMillis(200);
    private Duration maxDelay = Duration.ofSeconds(60);
    private Duration stuckTimeout = Duration.ofMinutes(5);

    public boolean isEnabled() { return enabled; }
    public void setEnabled(boolean enabled) { this.enabled = enabled; }

    public int getMaxAttempts() { return maxAttempts; }
    public void setMaxAttempts(int maxAttempts) { this.maxAttempts = maxAttempts; }

    public int getBatchSize() { return batchSize; }
    public void setBatchSize(int batchSize) { this.batchSize = batchSize; }

    public Duration getInterval() { return interval; }
    public void setInterval(Duration interval) { this.interval = interval; }

    public Duration getBaseDelay() { return baseDelay; }
    public void setBaseDelay(Duration baseDelay) { this.baseDelay = baseDelay; }

    public Duration getMaxDelay() { return maxDelay; }
    public void setMaxDelay(Duration maxDelay) { this.maxDelay = maxDelay; }

    public Duration getStuckTimeout() { return stuckTimeout; }
    public void setStuckTimeout(Duration stuckTimeout) { this.stuckTimeout = stuckTimeout; }
  }

  public static class Purge {
    private boolean enabled;
    private Duration retention = Duration.ofDays(7);
    private Duration interval = Duration.ofHours(1);

    public boolean isEnabled() { return enabled; }
    public void setEnabled(boolean enabled) { this.enabled = enabled; }

    public Duration getRetention() { return retention; }
    public void setRetention(Duration retention) { this.retention = retention; }

    public Duration getInterval() { return interval; }
    public void setInterval(Duration interval) { this.interval = interval; }
  }

  public static class Metrics {
    private boolean enabled = true;
    private String namePrefix = "outbox";

    public boolean isEnabled() { return enabled; }
    public void setEnabled(boolean enabled) { this.enabled = enabled; }

    public String getNamePrefix() { return namePrefix; }
    public void setNamePrefix(String namePrefix) { this.namePrefix = namePrefix; }
  }
}
