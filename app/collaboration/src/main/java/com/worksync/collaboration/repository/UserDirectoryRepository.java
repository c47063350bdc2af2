package com.worksync.collaboration.repository;

import com.worksync.collaboration.model.DigestRecipient;
import com.worksync.collaboration.model.UserIdentity;
import com.worksync.collaboration.model.UserPreferences;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.util.List;
import java.util.Optional;
import lombok.RequiredArgsConstructor;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.stereotype.Repository;

/** Users and their notification preferences. A missing preferences row means defaults. */
@Repository
@RequiredArgsConstructor
public class UserDirectoryRepository {

  private final NamedParameterJdbcTemplate jdbcTemplate;

  public List<DigestRecipient> findDigestRecipients() {
    final String sql =
        """
        SELECT u.id, u.email, u.full_name,
               COALESCE(p.morning_digest, TRUE) AS morning_digest,
               COALESCE(p.lunch_reminder, TRUE) AS lunch_reminder,
               COALESCE(p.end_of_day_summary, TRUE) AS end_of_day_summary,
               COALESCE(p.meeting_reminders, TRUE) AS meeting_reminders,
               COALESCE(p.task_reminders, TRUE) AS task_reminders,
               COALESCE(p.urgent_only, FALSE) AS urgent_only
        FROM users u
        LEFT JOIN user_preferences p ON p.user_id = u.id
        WHERE u.email_notifications = TRUE
        ORDER BY u.id
        """;
    return jdbcTemplate.query(sql, new MapSqlParameterSource(), this::mapRecipient);
  }

  public Optional<UserIdentity> findIdentityByEmail(String email) {
    final String sql = "SELECT id, email, full_name FROM users WHERE email = :email";
    return jdbcTemplate
        .query(
            sql,
            new MapSqlParameterSource().addValue("email", email),
            (rs, rowNum) ->
                UserIdentity.of(rs.getString("id"), rs.getString("email"), rs.getString("full_name")))
        .stream()
        .findFirst();
  }

  private DigestRecipient mapRecipient(ResultSet rs, int rowNum) throws SQLException {
    final UserPreferences preferences =
        new UserPreferences(
            rs.getBoolean("morning_digest"),
            rs.getBoolean("lunch_reminder"),
            rs.getBoolean("end_of_day_summary"),
            rs.getBoolean("meeting_reminders"),
            rs.getBoolean("task_reminders"),
            rs.getBoolean("urgent_only"));
    return new DigestRecipient(
        rs.getString("id"), rs.getString("email"), rs.getString("full_name"), preferences);
  }
}
