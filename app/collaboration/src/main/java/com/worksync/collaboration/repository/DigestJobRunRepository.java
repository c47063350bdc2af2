/*
 * Where: collaboration data access
 * What: ledger of digest job firings keyed by (job_name, window_key)
 * Why: a window is claimed before it runs, so restarts and overlapping nodes cannot fire it twice
 */
package com.worksync.collaboration.repository;

import static com.worksync.common.JdbcTimestampUtils.getInstant;
import static com.worksync.common.JdbcTimestampUtils.toTimestamp;

import com.worksync.collaboration.model.DigestJobRun;
import java.time.Instant;
import java.util.Optional;
import lombok.RequiredArgsConstructor;
import org.springframework.dao.DuplicateKeyException;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.stereotype.Repository;

@Repository
@RequiredArgsConstructor
public class DigestJobRunRepository {

  private final NamedParameterJdbcTemplate jdbcTemplate;

  /** Returns false when the window was already claimed. */
  public boolean claimWindow(String jobName, String windowKey, Instant firedAt) {
    final String sql =
        """
        INSERT INTO digest_job_runs (job_name, window_key, fired_at)
        VALUES (:jobName, :windowKey, :firedAt)
        """;
    final MapSqlParameterSource params =
        new MapSqlParameterSource()
            .addValue("jobName", jobName)
            .addValue("windowKey", windowKey)
            .addValue("firedAt", toTimestamp(firedAt));
    try {
      jdbcTemplate.update(sql, params);
      return true;
    } catch (DuplicateKeyException ex) {
      return false;
    }
  }

  public int complete(
      String jobName,
      String windowKey,
      Instant completedAt,
      int usersProcessed,
      int usersFailed,
      int usersSkipped) {
    final String sql =
        """
        UPDATE digest_job_runs
        SET completed_at = :completedAt,
            users_processed = :usersProcessed,
            users_failed = :usersFailed,
            users_skipped = :usersSkipped
        WHERE job_name = :jobName
          AND window_key = :windowKey
        """;
    final MapSqlParameterSource params =
        new MapSqlParameterSource()
            .addValue("jobName", jobName)
            .addValue("windowKey", windowKey)
            .addValue("completedAt", toTimestamp(completedAt))
            .addValue("usersProcessed", usersProcessed)
            .addValue("usersFailed", usersFailed)
            .addValue("usersSkipped", usersSkipped);
    return jdbcTemplate.update(sql, params);
  }

  public boolean exists(String jobName, String windowKey) {
    final String sql =
        """
        SELECT EXISTS (
          SELECT 1 FROM digest_job_runs WHERE job_name = :jobName AND window_key = :windowKey
        )
        """;
    final MapSqlParameterSource params =
        new MapSqlParameterSource().addValue("jobName", jobName).addValue("windowKey", windowKey);
    return Boolean.TRUE.equals(jdbcTemplate.queryForObject(sql, params, Boolean.class));
  }

  public Optional<DigestJobRun> find(String jobName, String windowKey) {
    final String sql =
        """
        SELECT job_name, window_key, fired_at, completed_at, users_processed, users_failed, users_skipped
        FROM digest_job_runs
        WHERE job_name = :jobName
          AND window_key = :windowKey
        """;
    final MapSqlParameterSource params =
        new MapSqlParameterSource().addValue("jobName", jobName).addValue("windowKey", windowKey);
    return jdbcTemplate
        .query(
            sql,
            params,
            (rs, rowNum) ->
                new DigestJobRun(
                    rs.getString("job_name"),
                    rs.getString("window_key"),
                    getInstant(rs, "fired_at"),
                    getInstant(rs, "completed_at"),
                    rs.getInt("users_processed"),
                    rs.getInt("users_failed"),
                    rs.getInt("users_skipped")))
        .stream()
        .findFirst();
  }
}
