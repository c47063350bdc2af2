package com.worksync.collaboration.digest;

import java.time.LocalDate;
import java.util.List;

/** Counts and agenda for the digest's focus day. */
public record DigestSummary(
    LocalDate focusDay,
    int tasksDue,
    int meetings,
    int upcomingDeadlines,
    int highPriorityItems,
    int completedToday,
    List<ScheduleItem> schedule,
    long unreadNotifications,
    List<PendingNotification> pendingNotifications) {

  public DigestSummary {
    schedule = List.copyOf(schedule);
    pendingNotifications = List.copyOf(pendingNotifications);
  }

  /** Unread in-app notification listed in the morning digest. */
  public record PendingNotification(String title, String message, String priority) {}

  public boolean isEmpty() {
    return tasksDue == 0
        && meetings == 0
        && upcomingDeadlines == 0
        && highPriorityItems == 0
        && completedToday == 0
        && schedule.isEmpty()
        && pendingNotifications.isEmpty();
  }
}
