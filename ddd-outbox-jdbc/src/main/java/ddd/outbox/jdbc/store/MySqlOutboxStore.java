package ddd.outbox.jdbc.store;

import ddd.outbox.jdbc.PayloadCodec;

import java.util.List;

/**
 * MySQL outbox store. Also handles MariaDB and TiDB URLs.
 *
 * <p>{@code payload} and {@code metadata} are {@code JSON} columns; MySQL accepts the
 * serialized text directly.
 */
public final class MySqlOutboxStore extends AbstractJdbcOutboxStore {

  public MySqlOutboxStore() {
    super();
  }

  public MySqlOutboxStore(String tableName, PayloadCodec codec) {
    super(tableName, codec);
  }

  @Override
  public String name() {
    return "mysql";
  }

  @Override
  public List<String> jdbcUrlPrefixes() {
    return List.of("jdbc:mysql:", "jdbc:mariadb:", "jdbc:tidb:");
  }

  @Override
  protected AbstractJdbcOutboxStore newInstance(String tableName, PayloadCodec codec) {
    return new MySqlOutboxStore(tableName, codec);
  }
}
