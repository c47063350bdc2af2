package com.worksync.collaboration.repository;

import static com.worksync.common.JdbcTimestampUtils.toTimestamp;

import java.time.Instant;
import java.util.UUID;
import lombok.RequiredArgsConstructor;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.stereotype.Repository;

/** Append-only log of digest and alert e-mails. */
@Repository
@RequiredArgsConstructor
public class NotificationHistoryRepository {

  private final NamedParameterJdbcTemplate jdbcTemplate;

  public UUID insert(String userId, String type, String windowKey, String dataJson, Instant sentAt) {
    final UUID id = UUID.randomUUID();
    final String sql =
        """
        INSERT INTO notification_history (id, user_id, type, window_key, data, sent_at)
        VALUES (:id, :userId, :type, :windowKey, :dataJson::jsonb, :sentAt)
        """;
    final MapSqlParameterSource params =
        new MapSqlParameterSource()
            .addValue("id", id)
            .addValue("userId", userId)
            .addValue("type", type)
            .addValue("windowKey", windowKey)
            .addValue("dataJson", dataJson)
            .addValue("sentAt", toTimestamp(sentAt));
    jdbcTemplate.update(sql, params);
    return id;
  }
}
