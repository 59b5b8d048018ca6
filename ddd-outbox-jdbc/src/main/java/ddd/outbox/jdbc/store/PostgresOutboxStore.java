package ddd.outbox.jdbc.store;

import ddd.outbox.jdbc.PayloadCodec;

import java.util.List;

/**
 * PostgreSQL outbox store.
 *
 * <p>{@code payload} and {@code metadata} are {@code JSONB} columns, so inserts cast the
 * bound text explicitly.
 */
public final class PostgresOutboxStore extends AbstractJdbcOutboxStore {

  public PostgresOutboxStore() {
    super();
  }

  public PostgresOutboxStore(String tableName, PayloadCodec codec) {
    super(tableName, codec);
  }

  @Override
  public String name() {
    return "postgresql";
  }

  @Override
  public List<String> jdbcUrlPrefixes() {
    return List.of("jdbc:postgresql:");
  }

  @Override
  protected String jsonPlaceholder() {
    return "CAST(? AS JSONB)";
  }

  @Override
  protected AbstractJdbcOutboxStore newInstance(String tableName, PayloadCodec codec) {
    return new PostgresOutboxStore(tableName, codec);
  }
}
