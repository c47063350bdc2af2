/*
 * Where: notification model
 * What: closed set of notification kinds and their persisted wire names
 * Why: each kind carries its own payload shape, see NotificationPayload
 */
package com.worksync.collaboration.model;

import java.util.Arrays;

public enum NotificationType {
  TASK_ASSIGNED("task_assigned"),
  TASK_ASSIGNED_IN_PROJECT("task_assigned_in_project"),
  TASK_UPDATED("task_updated"),
  COMMENT_ADDED("comment_added"),
  DEADLINE_APPROACHING("deadline_approaching"),
  MEETING_SCHEDULED("meeting_scheduled"),
  MEETING_REMINDER("meeting_reminder"),
  OVERDUE_TASKS("overdue_tasks"),
  STALE_TASKS("stale_tasks"),
  SCHEDULE_CONFLICT("schedule_conflict"),
  WORKLOAD_SPIKE("workload_spike"),
  PROJECT_MILESTONE("project_milestone"),
  PROJECT_DEADLINE("project_deadline"),
  PROJECT_UPDATE("project_update"),
  AI_INSIGHT("ai_insight");

  private final String wireValue;

  NotificationType(String wireValue) {
    this.wireValue = wireValue;
  }

  public String wireValue() {
    return wireValue;
  }

  public static NotificationType fromWireValue(String value) {
    return Arrays.stream(values())
        .filter(type -> type.wireValue.equals(value))
        .findFirst()
        .orElseThrow(() -> new IllegalArgumentException("unknown notification type: " + value));
  }
}
