/*
 * Where: notification model
 * What: typed payload per notification kind, persisted as the JSONB "data" column
 * Why: producers and the digest pipeline build payloads without hand-written JSON maps
 */
package com.worksync.collaboration.model;

import com.fasterxml.jackson.annotation.JsonValue;
import com.fasterxml.jackson.databind.JsonNode;
import java.time.Instant;
import java.util.List;

public interface NotificationPayload {

  NotificationType type();

  record TaskRef(String id, String title, Instant deadline) {

    public static TaskRef of(TaskRecord task) {
      return new TaskRef(task.id(), task.title(), task.deadline());
    }
  }

  record MeetingRef(String id, String title, Instant startsAt) {

    public static MeetingRef of(MeetingRecord meeting) {
      return new MeetingRef(meeting.id(), meeting.title(), meeting.startsAt());
    }
  }

  record TaskAssigned(String taskId, String taskTitle, String assignedBy)
      implements NotificationPayload {
    @Override
    public NotificationType type() {
      return NotificationType.TASK_ASSIGNED;
    }
  }

  /** Sent to the project owner when someone else receives a task. */
  record TaskAssignedInProject(
      String taskId, String projectId, String taskTitle, String assigneeId, String assigneeName, String assignedBy)
      implements NotificationPayload {
    @Override
    public NotificationType type() {
      return NotificationType.TASK_ASSIGNED_IN_PROJECT;
    }
  }

  record TaskUpdated(String taskId, String projectId, String taskTitle, String updatedBy)
      implements NotificationPayload {
    @Override
    public NotificationType type() {
      return NotificationType.TASK_UPDATED;
    }
  }

  record CommentAdded(String taskId, String taskTitle, String commenterName)
      implements NotificationPayload {
    @Override
    public NotificationType type() {
      return NotificationType.COMMENT_ADDED;
    }
  }

  record DeadlineApproaching(String taskId, String taskTitle, Instant deadline)
      implements NotificationPayload {
    @Override
    public NotificationType type() {
      return NotificationType.DEADLINE_APPROACHING;
    }
  }

  record MeetingScheduled(String meetingId, String meetingTitle, Instant scheduledAt)
      implements NotificationPayload {
    @Override
    public NotificationType type() {
      return NotificationType.MEETING_SCHEDULED;
    }
  }

  record MeetingReminder(String meetingId, String meetingTitle, Instant startsAt, long minutesUntilStart)
      implements NotificationPayload {
    @Override
    public NotificationType type() {
      return NotificationType.MEETING_REMINDER;
    }
  }

  record OverdueTasks(List<TaskRef> tasks) implements NotificationPayload {
    public OverdueTasks {
      tasks = List.copyOf(tasks);
    }

    @Override
    public NotificationType type() {
      return NotificationType.OVERDUE_TASKS;
    }
  }

  record StaleTasks(List<TaskRef> tasks) implements NotificationPayload {
    public StaleTasks {
      tasks = List.copyOf(tasks);
    }

    @Override
    public NotificationType type() {
      return NotificationType.STALE_TASKS;
    }
  }

  record ScheduleConflict(MeetingRef first, MeetingRef second) implements NotificationPayload {
    @Override
    public NotificationType type() {
      return NotificationType.SCHEDULE_CONFLICT;
    }
  }

  record WorkloadSpike(int openTasksDue, int threshold, int percentAboveThreshold, long windowDays)
      implements NotificationPayload {
    @Override
    public NotificationType type() {
      return NotificationType.WORKLOAD_SPIKE;
    }
  }

  record ProjectMilestone(String projectId, String milestoneTitle, String description)
      implements NotificationPayload {
    @Override
    public NotificationType type() {
      return NotificationType.PROJECT_MILESTONE;
    }
  }

  record ProjectDeadline(String projectId, String deadlineTitle, Instant dueAt)
      implements NotificationPayload {
    @Override
    public NotificationType type() {
      return NotificationType.PROJECT_DEADLINE;
    }
  }

  record ProjectUpdate(String projectId, String updateTitle, String summary, String updatedBy)
      implements NotificationPayload {
    @Override
    public NotificationType type() {
      return NotificationType.PROJECT_UPDATE;
    }
  }

  /** Produced by an external scorer; the body is stored as-is. */
  record AiInsight(@JsonValue JsonNode details) implements NotificationPayload {
    @Override
    public NotificationType type() {
      return NotificationType.AI_INSIGHT;
    }
  }
}
