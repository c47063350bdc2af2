/*
 * Where: collaboration data access
 * What: reads a user's open tasks and meetings from the CRUD layer's tables
 * Why: the digest generator evaluates triggers against this snapshot
 */
package com.worksync.collaboration.repository;

import static com.worksync.common.JdbcTimestampUtils.getInstant;
import static com.worksync.common.JdbcTimestampUtils.toTimestamp;

import com.worksync.collaboration.model.MeetingRecord;
import com.worksync.collaboration.model.TaskPriority;
import com.worksync.collaboration.model.TaskRecord;
import com.worksync.collaboration.model.TaskStatus;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import lombok.RequiredArgsConstructor;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.stereotype.Repository;

@Repository
@RequiredArgsConstructor
public class WorkloadRepository {

  private static final String TASK_COLUMNS =
      "id, project_id, title, status, priority, assignee_id, deadline, updated_at";

  private final NamedParameterJdbcTemplate jdbcTemplate;

  public List<TaskRecord> findOpenTasksAssignedTo(String userId) {
    final String sql =
        "SELECT "
            + TASK_COLUMNS
            + """

              FROM tasks
              WHERE assignee_id = :userId
                AND status <> 'done'
              ORDER BY deadline NULLS LAST, id
              """;
    return jdbcTemplate.query(
        sql, new MapSqlParameterSource().addValue("userId", userId), this::mapTask);
  }

  public int countCompletedBetween(String userId, Instant from, Instant to) {
    final String sql =
        """
        SELECT COUNT(*)
        FROM tasks
        WHERE assignee_id = :userId
          AND status = 'done'
          AND updated_at >= :from
          AND updated_at < :to
        """;
    final MapSqlParameterSource params =
        new MapSqlParameterSource()
            .addValue("userId", userId)
            .addValue("from", toTimestamp(from))
            .addValue("to", toTimestamp(to));
    final Integer count = jdbcTemplate.queryForObject(sql, params, Integer.class);
    return count == null ? 0 : count;
  }

  public Optional<TaskRecord> findTask(String taskId) {
    final String sql = "SELECT " + TASK_COLUMNS + " FROM tasks WHERE id = :taskId";
    return jdbcTemplate
        .query(sql, new MapSqlParameterSource().addValue("taskId", taskId), this::mapTask)
        .stream()
        .findFirst();
  }

  /** Meetings the user attends that start in {@code [from, to)}, cancelled ones excluded. */
  public List<MeetingRecord> findMeetingsForAttendee(String userId, Instant from, Instant to) {
    // scheduled_date + scheduled_time are local to the meeting's own time zone
    final String sql =
        """
        SELECT id, project_id, title, starts_at, duration_minutes, status
        FROM (
          SELECT id, project_id, title, duration_minutes, status, attendees,
                 (scheduled_date + scheduled_time) AT TIME ZONE timezone AS starts_at
          FROM meetings
        ) m
        WHERE m.attendees @> jsonb_build_array(CAST(:userId AS text))
          AND m.status <> 'cancelled'
          AND m.starts_at >= :from
          AND m.starts_at < :to
        ORDER BY m.starts_at, m.id
        """;
    final MapSqlParameterSource params =
        new MapSqlParameterSource()
            .addValue("userId", userId)
            .addValue("from", toTimestamp(from))
            .addValue("to", toTimestamp(to));
    return jdbcTemplate.query(sql, params, this::mapMeeting);
  }

  private TaskRecord mapTask(ResultSet rs, int rowNum) throws SQLException {
    return new TaskRecord(
        rs.getString("id"),
        rs.getString("project_id"),
        rs.getString("title"),
        TaskStatus.fromWireValue(rs.getString("status")),
        TaskPriority.fromWireValue(rs.getString("priority")),
        rs.getString("assignee_id"),
        getInstant(rs, "deadline"),
        getInstant(rs, "updated_at"));
  }

  private MeetingRecord mapMeeting(ResultSet rs, int rowNum) throws SQLException {
    return new MeetingRecord(
        rs.getString("id"),
        rs.getString("project_id"),
        rs.getString("title"),
        getInstant(rs, "starts_at"),
        rs.getInt("duration_minutes"),
        rs.getString("status"));
  }
}
