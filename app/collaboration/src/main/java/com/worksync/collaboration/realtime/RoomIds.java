package com.worksync.collaboration.realtime;

public final class RoomIds {

  public static final String USER_PREFIX = "user:";
  public static final String PROJECT_PREFIX = "project:";

  private RoomIds() {}

  public static String user(String userId) {
    return USER_PREFIX + requireId(userId, "userId");
  }

  public static String project(String projectId) {
    return PROJECT_PREFIX + requireId(projectId, "projectId");
  }

  public static boolean isProjectRoom(String roomId) {
    return roomId.startsWith(PROJECT_PREFIX);
  }

  public static String projectIdOf(String roomId) {
    if (!isProjectRoom(roomId)) {
      throw new IllegalArgumentException("not a project room: " + roomId);
    }
    return roomId.substring(PROJECT_PREFIX.length());
  }

  private static String requireId(String id, String name) {
    if (id == null || id.isBlank()) {
      throw new IllegalArgumentException(name + " must not be blank");
    }
    return id;
  }
}
