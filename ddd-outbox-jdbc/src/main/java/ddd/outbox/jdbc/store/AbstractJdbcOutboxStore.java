package ddd.outbox.jdbc.store;

import ddd.outbox.jdbc.JacksonPayloadCodec;
import ddd.outbox.jdbc.JdbcTemplate;
import ddd.outbox.jdbc.PayloadCodec;
import ddd.outbox.jdbc.TableNames;
import ddd.outbox.model.MessagePriority;
import ddd.outbox.model.MessageStatus;
import ddd.outbox.model.OutboxMessage;

import java.sql.Connection;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Timestamp;
import java.time.Instant;
import java.util.List;
import java.util.Objects;

/**
 * Base JDBC outbox store with standard SQL implementations.
 *
 * <p>Stores are stateless apart from their table name and {@link PayloadCodec}; every
 * operation runs on the {@link Connection} passed in and leaves transaction control to the
 * caller. Status and priority are stored as their numeric codes. Updates never touch a row
 * that is already {@code PROCESSED}. The {@code claimed_at} column records when a row last
 * moved to {@code PROCESSING}.
 *
 * <p>Register custom implementations via
 * {@code META-INF/services/ddd.outbox.jdbc.store.AbstractJdbcOutboxStore}.
 *
 * @see JdbcOutboxStores
 */
public abstract class AbstractJdbcOutboxStore {
  private static final int MAX_ERROR_LENGTH = 4000;

  protected static final String COLUMNS = "id, message_type, payload, metadata, status, priority, "
      + "attempts, created_at, process_after, last_error";

  private static final int PROCESSED = MessageStatus.PROCESSED.code();

  private final String tableName;
  private final PayloadCodec codec;

  protected AbstractJdbcOutboxStore() {
    this(TableNames.DEFAULT_TABLE, JacksonPayloadCodec.create());
  }

  protected AbstractJdbcOutboxStore(String tableName, PayloadCodec codec) {
    this.tableName = TableNames.validate(tableName);
    this.codec = Objects.requireNonNull(codec, "codec");
  }

  /**
   * Unique identifier for this outbox store (e.g., "mysql", "postgresql", "h2").
   */
  public abstract String name();

  /**
   * JDBC URL prefixes this outbox store handles (e.g., "jdbc:mysql:", "jdbc:mariadb:").
   */
  public abstract List<String> jdbcUrlPrefixes();

  /**
   * Creates a store of the same dialect with another table name and codec.
   */
  protected abstract AbstractJdbcOutboxStore newInstance(String tableName, PayloadCodec codec);

  public final AbstractJdbcOutboxStore withTableName(String tableName) {
    return newInstance(tableName, codec);
  }

  public final AbstractJdbcOutboxStore withPayloadCodec(PayloadCodec codec) {
    return newInstance(tableName, codec);
  }

  public String tableName() {
    return tableName;
  }

  protected PayloadCodec codec() {
    return codec;
  }

  /**
   * Placeholder used for the JSON {@code payload} and {@code metadata} columns.
   */
  protected String jsonPlaceholder() {
    return "?";
  }

  public void insert(Connection conn, OutboxMessage<?> message) {
    String json = jsonPlaceholder();
    String sql = "INSERT INTO " + tableName + " (" + COLUMNS + ") VALUES (?,?," + json + "," + json
        + ",?,?,?,?,?,?)";
    JdbcTemplate.update(conn, sql,
        message.id(),
        message.messageType(),
        codec.encodePayload(message.payload()),
        codec.encodeMetadata(message.metadata()),
        message.status().code(),
        message.priority().code(),
        message.attempts(),
        Timestamp.from(message.createdAt()),
        toTimestamp(message.processAfter()),
        truncateError(message.lastError()));
  }

  public List<OutboxMessage<?>> selectPending(Connection conn, Instant now, int limit,
      List<MessagePriority> priorityOrder) {
    String sql = "SELECT " + COLUMNS + " FROM " + tableName
        + " WHERE status=" + MessageStatus.PENDING.code()
        + " AND (process_after IS NULL OR process_after <= ?)"
        + " ORDER BY " + priorityRank(priorityOrder) + ", created_at, id LIMIT ?";
    return JdbcTemplate.query(conn, sql, this::mapRow, Timestamp.from(now), limit);
  }

  public OutboxMessage<?> selectById(Connection conn, String id) {
    String sql = "SELECT " + COLUMNS + " FROM " + tableName + " WHERE id=?";
    List<OutboxMessage<?>> rows = JdbcTemplate.query(conn, sql, this::mapRow, id);
    return rows.isEmpty() ? null : rows.get(0);
  }

  public int updateStatus(Connection conn, String id, MessageStatus status, String error) {
    if (status == MessageStatus.FAILED && error != null) {
      String sql = "UPDATE " + tableName + " SET status=?, last_error=?"
          + " WHERE id=? AND status<>" + PROCESSED;
      return JdbcTemplate.update(conn, sql, status.code(), truncateError(error), id);
    }
    String sql = "UPDATE " + tableName + " SET status=? WHERE id=? AND status<>" + PROCESSED;
    return JdbcTemplate.update(conn, sql, status.code(), id);
  }

  /**
   * Moves a row to {@code PROCESSING} and records {@code claimedAt} as its claim time.
   */
  public int claim(Connection conn, String id, Instant claimedAt) {
    String sql = "UPDATE " + tableName + " SET status=" + MessageStatus.PROCESSING.code()
        + ", claimed_at=? WHERE id=? AND status<>" + PROCESSED;
    return JdbcTemplate.update(conn, sql, Timestamp.from(claimedAt), id);
  }

  /**
   * Moves {@code PROCESSING} rows claimed before {@code claimedBefore}, or never claimed, to
   * {@code FAILED} with one more attempt.
   */
  public int failStuck(Connection conn, Instant claimedBefore, String error) {
    String sql = "UPDATE " + tableName + " SET status=" + MessageStatus.FAILED.code()
        + ", attempts=attempts+1, last_error=?"
        + " WHERE status=" + MessageStatus.PROCESSING.code()
        + " AND (claimed_at IS NULL OR claimed_at < ?)";
    return JdbcTemplate.update(conn, sql, truncateError(error), Timestamp.from(claimedBefore));
  }

  /**
   * Increments the attempt counter and returns the stored count, or {@code 0} for an
   * unknown id.
   */
  public int incrementAttempt(Connection conn, String id) {
    JdbcTemplate.update(conn, "UPDATE " + tableName + " SET attempts=attempts+1"
        + " WHERE id=? AND status<>" + PROCESSED, id);
    List<Integer> attempts = JdbcTemplate.query(conn,
        "SELECT attempts FROM " + tableName + " WHERE id=?", rs -> rs.getInt(1), id);
    return attempts.isEmpty() ? 0 : attempts.get(0);
  }

  public int deleteByStatusAndAge(Connection conn, Instant olderThan, MessageStatus status) {
    String sql = "DELETE FROM " + tableName + " WHERE status=? AND created_at < ?";
    return JdbcTemplate.update(conn, sql, status.code(), Timestamp.from(olderThan));
  }

  public List<OutboxMessage<?>> selectFailed(Connection conn, int limit, int maxAttempts) {
    String sql = "SELECT " + COLUMNS + " FROM " + tableName
        + " WHERE status=" + MessageStatus.FAILED.code() + " AND attempts < ?"
        + " ORDER BY created_at, id LIMIT ?";
    return JdbcTemplate.query(conn, sql, this::mapRow, maxAttempts, limit);
  }

  public int requeue(Connection conn, String id, Instant processAfter) {
    String sql = "UPDATE " + tableName + " SET status=" + MessageStatus.PENDING.code()
        + ", process_after=? WHERE id=? AND status=" + MessageStatus.FAILED.code();
    return JdbcTemplate.update(conn, sql, toTimestamp(processAfter), id);
  }

  /**
   * Builds an ORDER BY expression ranking priorities by their position in
   * {@code priorityOrder}. Priorities missing from the list rank last.
   */
  protected static String priorityRank(List<MessagePriority> priorityOrder) {
    if (priorityOrder.isEmpty()) {
      throw new IllegalArgumentException("priorityOrder cannot be empty");
    }
    StringBuilder sql = new StringBuilder("CASE priority");
    for (int i = 0; i < priorityOrder.size(); i++) {
      sql.append(" WHEN ").append(priorityOrder.get(i).code()).append(" THEN ").append(i);
    }
    return sql.append(" ELSE ").append(priorityOrder.size()).append(" END").toString();
  }

  protected OutboxMessage<?> mapRow(ResultSet rs) throws SQLException {
    String messageType = rs.getString("message_type");
    Timestamp processAfter = rs.getTimestamp("process_after");
    return OutboxMessage.builder(messageType, codec.decodePayload(messageType, rs.getString("payload")))
        .id(rs.getString("id"))
        .metadata(codec.decodeMetadata(rs.getString("metadata")))
        .status(MessageStatus.fromCode(rs.getInt("status")))
        .priority(MessagePriority.fromCode(rs.getInt("priority")))
        .attempts(rs.getInt("attempts"))
        .createdAt(rs.getTimestamp("created_at").toInstant())
        .processAfter(processAfter == null ? null : processAfter.toInstant())
        .lastError(rs.getString("last_error"))
        .build();
  }

  private static Timestamp toTimestamp(Instant instant) {
    return instant == null ? null : Timestamp.from(instant);
  }

  private static String truncateError(String error) {
    if (error == null || error.length() <= MAX_ERROR_LENGTH) {
      return error;
    }
    return error.substring(0, MAX_ERROR_LENGTH - 3) + "...";
  }
}
