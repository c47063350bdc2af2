/*
 * Where: realtime layer
 * What: server-to-client frame {"event": name, "data": payload} and the payload shapes we emit
 * Why: every outbound frame goes through the dispatcher as one of these
 */
package com.worksync.collaboration.realtime;

import com.fasterxml.jackson.databind.JsonNode;
import com.worksync.collaboration.model.NotificationRecord;
import java.time.Instant;
import java.util.UUID;

public record OutboundEvent(String event, Object data) {

  public static final String JOINED_USER_ROOM = "joined_user_room";
  public static final String JOINED_PROJECT = "joined_project";
  public static final String USER_JOINED_PROJECT = "user_joined_project";
  public static final String USER_LEFT_PROJECT = "user_left_project";
  public static final String TASK_UPDATED = "task_updated";
  public static final String COMMENT_ADDED = "comment_added";
  public static final String USER_TYPING = "user_typing";
  public static final String USER_VIEWING = "user_viewing";
  public static final String PROJECT_ACCESS_REVOKED = "project_access_revoked";
  public static final String NOTIFICATION = "notification";
  public static final String ERROR = "error";

  public record UserRoomAck(String userId) {}

  public record ProjectAck(String projectId) {}

  public record ProjectPresence(String userId, String userEmail, String projectId) {}

  public record TaskChange(String taskId, String projectId, JsonNode changes, String updatedBy) {}

  public record CommentChange(String taskId, String projectId, JsonNode comment, String addedBy) {}

  public record Typing(String taskId, String userId, String userName) {}

  public record Viewing(String entityId, String entityType, String userId, String userName) {}

  public record ErrorMessage(String message) {}

  public record NotificationPush(
      UUID id,
      String type,
      String priority,
      String title,
      String message,
      String userId,
      JsonNode data,
      Instant timestamp) {}

  public static OutboundEvent joinedUserRoom(String userId) {
    return new OutboundEvent(JOINED_USER_ROOM, new UserRoomAck(userId));
  }

  public static OutboundEvent joinedProject(String projectId) {
    return new OutboundEvent(JOINED_PROJECT, new ProjectAck(projectId));
  }

  public static OutboundEvent userJoinedProject(LiveConnection connection, String projectId) {
    return new OutboundEvent(
        USER_JOINED_PROJECT,
        new ProjectPresence(connection.userId(), connection.identity().email(), projectId));
  }

  public static OutboundEvent userLeftProject(LiveConnection connection, String projectId) {
    return new OutboundEvent(
        USER_LEFT_PROJECT,
        new ProjectPresence(connection.userId(), connection.identity().email(), projectId));
  }

  public static OutboundEvent accessRevoked(String projectId) {
    return new OutboundEvent(PROJECT_ACCESS_REVOKED, new ProjectAck(projectId));
  }

  public static OutboundEvent error(String message) {
    return new OutboundEvent(ERROR, new ErrorMessage(message));
  }

  public static OutboundEvent notification(NotificationRecord record, JsonNode data) {
    return new OutboundEvent(
        NOTIFICATION,
        new NotificationPush(
            record.id(),
            record.type().wireValue(),
            record.priority().wireValue(),
            record.title(),
            record.message(),
            record.userId(),
            data,
            record.createdAt()));
  }
}
