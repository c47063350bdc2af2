/*
 * Where: collaboration data access
 * What: project ownership/membership checks and recipient lookups
 * Why: room joins and project notifications must only reach authorized users
 */
package com.worksync.collaboration.repository;

import java.util.List;
import java.util.Optional;
import lombok.RequiredArgsConstructor;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.stereotype.Repository;

@Repository
@RequiredArgsConstructor
public class ProjectAccessRepository {

  private final NamedParameterJdbcTemplate jdbcTemplate;

  public boolean isOwnerOrMember(String projectId, String userId) {
    final String sql =
        """
        SELECT EXISTS (
          SELECT 1 FROM projects WHERE id = :projectId AND owner_id = :userId
          UNION ALL
          SELECT 1 FROM project_members WHERE project_id = :projectId AND user_id = :userId
        )
        """;
    final MapSqlParameterSource params =
        new MapSqlParameterSource().addValue("projectId", projectId).addValue("userId", userId);
    return Boolean.TRUE.equals(jdbcTemplate.queryForObject(sql, params, Boolean.class));
  }

  /** Owner first, then members in join order; no duplicates. */
  public List<String> findRecipientUserIds(String projectId) {
    final String sql =
        """
        SELECT user_id FROM (
          SELECT owner_id AS user_id, 0 AS ord, created_at AS since FROM projects WHERE id = :projectId
          UNION
          SELECT user_id, 1 AS ord, joined_at AS since FROM project_members WHERE project_id = :projectId
        ) recipients
        GROUP BY user_id
        ORDER BY MIN(ord), MIN(since), user_id
        """;
    return jdbcTemplate.queryForList(
        sql, new MapSqlParameterSource().addValue("projectId", projectId), String.class);
  }

  public Optional<String> findOwnerId(String projectId) {
    final String sql = "SELECT owner_id FROM projects WHERE id = :projectId";
    return jdbcTemplate
        .queryForList(sql, new MapSqlParameterSource().addValue("projectId", projectId), String.class)
        .stream()
        .findFirst();
  }

  public Optional<String> findProjectIdForTask(String taskId) {
    final String sql = "SELECT project_id FROM tasks WHERE id = :taskId";
    return jdbcTemplate
        .queryForList(sql, new MapSqlParameterSource().addValue("taskId", taskId), String.class)
        .stream()
        .findFirst();
  }
}
