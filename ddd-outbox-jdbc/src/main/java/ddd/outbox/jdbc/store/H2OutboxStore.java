package ddd.outbox.jdbc.store;

import ddd.outbox.jdbc.PayloadCodec;

import java.util.List;

/**
 * H2 outbox store. Primarily for testing.
 */
public final class H2OutboxStore extends AbstractJdbcOutboxStore {

  public H2OutboxStore() {
    super();
  }

  public H2OutboxStore(String tableName, PayloadCodec codec) {
    super(tableName, codec);
  }

  @Override
  public String name() {
    return "h2";
  }

  @Override
  public List<String> jdbcUrlPrefixes() {
    return List.of("jdbc:h2:");
  }

  @Override
  protected AbstractJdbcOutboxStore newInstance(String tableName, PayloadCodec codec) {
    return new H2OutboxStore(tableName, codec);
  }
}
