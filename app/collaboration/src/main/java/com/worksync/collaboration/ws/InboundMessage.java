package com.worksync.collaboration.ws;

import com.fasterxml.jackson.databind.JsonNode;

/** Client frame {@code {"event": name, "data": {...}}}. */
public record InboundMessage(String event, JsonNode data) {

  public static final String JOIN_USER_ROOM = "join_user_room";
  public static final String JOIN_PROJECT = "join_project";
  public static final String LEAVE_PROJECT = "leave_project";
  public static final String TASK_UPDATED = "task_updated";
  public static final String COMMENT_ADDED = "comment_added";
  public static final String TYPING = "typing";
  public static final String VIEWING = "viewing";

  /**
   * Reads an id argument. Single-argument events may also send the bare id as {@code data}, the
   * way older clients do.
   */
  public String idArgument(String field) {
    if (data != null && data.isTextual()) {
      return requireNonBlank(field, data.asText());
    }
    return requiredText(field);
  }

  public String requiredText(String field) {
    final JsonNode value = data == null ? null : data.get(field);
    if (value == null || !value.isTextual()) {
      throw new IllegalArgumentException(field + " is required");
    }
    return requireNonBlank(field, value.asText());
  }

  public JsonNode optionalNode(String field) {
    return data == null ? null : data.get(field);
  }

  private static String requireNonBlank(String field, String value) {
    if (value.isBlank()) {
      throw new IllegalArgumentException(field + " is required");
    }
    return value;
  }
}
