/*
 * Where: collaboration data access
 * What: insert, page, count and read-state updates on the notifications table
 * Why: the notification store and the REST surface share these queries; every query is owner-scoped
 */
package com.worksync.collaboration.repository;

import static com.worksync.common.JdbcTimestampUtils.getInstant;
import static com.worksync.common.JdbcTimestampUtils.toTimestamp;

import com.worksync.collaboration.model.NotificationPriority;
import com.worksync.collaboration.model.NotificationRecord;
import com.worksync.collaboration.model.NotificationType;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import lombok.RequiredArgsConstructor;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.jdbc.core.namedparam.SqlParameterSource;
import org.springframework.stereotype.Repository;

@Repository
@RequiredArgsConstructor
public class NotificationRepository {

  private static final String INSERT_SQL =
      """
      INSERT INTO notifications (
        id, user_id, type, title, message, priority, data, read, read_at, created_at
      ) VALUES (
        :id, :userId, :type, :title, :message, :priority, :dataJson::jsonb, :read, :readAt, :createdAt
      )
      """;

  private static final String SELECT_COLUMNS =
      """
      id, user_id, type, title, message, priority, data::text AS data_json, read, read_at, created_at
      """;

  private final NamedParameterJdbcTemplate jdbcTemplate;

  public UUID insert(NotificationRecord record) {
    jdbcTemplate.update(INSERT_SQL, toParams(record));
    return record.id();
  }

  /** Single JDBC batch; callers wrap it in a transaction for all-or-nothing semantics. */
  public int insertAll(List<NotificationRecord> records) {
    if (records.isEmpty()) {
      return 0;
    }
    final SqlParameterSource[] batch =
        records.stream().map(this::toParams).toArray(SqlParameterSource[]::new);
    final int[] counts = jdbcTemplate.batchUpdate(INSERT_SQL, batch);
    return counts.length;
  }

  public List<NotificationRecord> findPageByUserId(String userId, int limit, int offset) {
    final String sql =
        "SELECT "
            + SELECT_COLUMNS
            + """
              FROM notifications
              WHERE user_id = :userId
              ORDER BY created_at DESC, id
              LIMIT :limit OFFSET :offset
              """;
    final MapSqlParameterSource params =
        new MapSqlParameterSource()
            .addValue("userId", userId)
            .addValue("limit", limit)
            .addValue("offset", offset);
    return jdbcTemplate.query(sql, params, this::mapRow);
  }

  /** Newest unread records first. */
  public List<NotificationRecord> findUnreadByUserId(String userId, int limit) {
    final String sql =
        "SELECT "
            + SELECT_COLUMNS
            + """
              FROM notifications
              WHERE user_id = :userId AND read = FALSE
              ORDER BY created_at DESC, id
              LIMIT :limit
              """;
    final MapSqlParameterSource params =
        new MapSqlParameterSource().addValue("userId", userId).addValue("limit", limit);
    return jdbcTemplate.query(sql, params, this::mapRow);
  }

  public long countByUserId(String userId) {
    final String sql = "SELECT COUNT(*) FROM notifications WHERE user_id = :userId";
    final Long count =
        jdbcTemplate.queryForObject(
            sql, new MapSqlParameterSource().addValue("userId", userId), Long.class);
    return count == null ? 0L : count;
  }

  public long countUnread(String userId) {
    final String sql =
        "SELECT COUNT(*) FROM notifications WHERE user_id = :userId AND read = FALSE";
    final Long count =
        jdbcTemplate.queryForObject(
            sql, new MapSqlParameterSource().addValue("userId", userId), Long.class);
    return count == null ? 0L : count;
  }

  /**
   * Sets the read flag on a notification owned by {@code userId}. {@code read_at} keeps the first
   * read time and is cleared when the record goes back to unread.
   *
   * @return the updated record, empty when the id is unknown or belongs to someone else
   */
  public Optional<NotificationRecord> updateReadState(
      UUID id, String userId, boolean read, Instant now) {
    final String sql =
        """
        UPDATE notifications
        SET read = :read,
            read_at = CASE WHEN :read THEN COALESCE(read_at, :now) ELSE NULL END
        WHERE id = :id
          AND user_id = :userId
        RETURNING
        """
            + SELECT_COLUMNS;
    final MapSqlParameterSource params =
        new MapSqlParameterSource()
            .addValue("id", id)
            .addValue("userId", userId)
            .addValue("read", read)
            .addValue("now", toTimestamp(now));
    return jdbcTemplate.query(sql, params, this::mapRow).stream().findFirst();
  }

  public int markAllRead(String userId, Instant now) {
    final String sql =
        """
        UPDATE notifications
        SET read = TRUE,
            read_at = :now
        WHERE user_id = :userId
          AND read = FALSE
        """;
    final MapSqlParameterSource params =
        new MapSqlParameterSource().addValue("userId", userId).addValue("now", toTimestamp(now));
    return jdbcTemplate.update(sql, params);
  }

  public int delete(UUID id, String userId) {
    final String sql = "DELETE FROM notifications WHERE id = :id AND user_id = :userId";
    final MapSqlParameterSource params =
        new MapSqlParameterSource().addValue("id", id).addValue("userId", userId);
    return jdbcTemplate.update(sql, params);
  }

  private MapSqlParameterSource toParams(NotificationRecord record) {
    return new MapSqlParameterSource()
        .addValue("id", record.id())
        .addValue("userId", record.userId())
        .addValue("type", record.type().wireValue())
        .addValue("title", record.title())
        .addValue("message", record.message())
        .addValue("priority", record.priority().wireValue())
        .addValue("dataJson", record.dataJson())
        .addValue("read", record.read())
        .addValue("readAt", toTimestamp(record.readAt()))
        .addValue("createdAt", toTimestamp(record.createdAt()));
  }

  private NotificationRecord mapRow(ResultSet rs, int rowNum) throws SQLException {
    return new NotificationRecord(
        rs.getObject("id", UUID.class),
        rs.getString("user_id"),
        NotificationType.fromWireValue(rs.getString("type")),
        rs.getString("title"),
        rs.getString("message"),
        NotificationPriority.fromWireValue(rs.getString("priority")),
        rs.getString("data_json"),
        rs.getBoolean("read"),
        getInstant(rs, "read_at"),
        getInstant(rs, "created_at"));
  }
}
