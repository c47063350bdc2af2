/*
 * Where: digest pipeline
 * What: turns one user's open tasks and meetings into prioritized notification candidates
 * Why: kept free of I/O and clocks so the same snapshot always yields the same candidates
 */
package com.worksync.collaboration.digest;

import com.worksync.collaboration.model.MeetingRecord;
import com.worksync.collaboration.model.NotificationPayload;
import com.worksync.collaboration.model.NotificationPriority;
import com.worksync.collaboration.model.TaskRecord;
import com.worksync.collaboration.model.TaskStatus;
import java.time.Duration;
import java.time.Instant;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * Rules, each applied independently:
 *
 * <ul>
 *   <li>open tasks past their deadline: one urgent candidate listing all of them
 *   <li>meetings starting within the lookahead: one high candidate per meeting
 *   <li>tasks still in {@code todo} that are due today: one medium candidate listing all of them
 *   <li>overlapping meetings: one high candidate per overlapping pair
 *   <li>open tasks due inside the workload window reaching the threshold: one medium candidate
 * </ul>
 *
 * Candidates come out in that rule order; inside a rule, by time then id.
 */
public class TriggerEvaluator {

  private static final Comparator<TaskRecord> TASK_ORDER =
      Comparator.comparing(TaskRecord::deadline, Comparator.nullsLast(Comparator.naturalOrder()))
          .thenComparing(TaskRecord::id);
  private static final Comparator<MeetingRecord> MEETING_ORDER =
      Comparator.comparing(MeetingRecord::startsAt).thenComparing(MeetingRecord::id);

  private final TriggerPolicy policy;

  public TriggerEvaluator(TriggerPolicy policy) {
    this.policy = policy;
  }

  public List<Candidate> evaluate(List<TaskRecord> tasks, List<MeetingRecord> meetings, Instant now) {
    final List<TaskRecord> sortedTasks = tasks.stream().sorted(TASK_ORDER).toList();
    final List<MeetingRecord> activeMeetings =
        meetings.stream().filter(meeting -> !meeting.isCancelled()).sorted(MEETING_ORDER).toList();

    final List<Candidate> candidates = new ArrayList<>();
    overdue(sortedTasks, now, candidates);
    meetingReminders(activeMeetings, now, candidates);
    staleTasks(sortedTasks, now, candidates);
    scheduleConflicts(activeMeetings, candidates);
    workloadSpike(sortedTasks, now, candidates);
    return List.copyOf(candidates);
  }

  private void overdue(List<TaskRecord> tasks, Instant now, List<Candidate> out) {
    final List<TaskRecord> overdue =
        tasks.stream()
            .filter(TaskRecord::isOpen)
            .filter(task -> task.deadline() != null && task.deadline().isBefore(now))
            .toList();
    if (overdue.isEmpty()) {
      return;
    }
    final String title =
        overdue.size() == 1
            ? "Overdue task: " + overdue.get(0).title()
            : overdue.size() + " overdue tasks";
    out.add(
        new Candidate(
            NotificationPriority.URGENT,
            title,
            "You have " + overdue.size() + " task(s) past their deadline.",
            new NotificationPayload.OverdueTasks(
                overdue.stream().map(NotificationPayload.TaskRef::of).toList())));
  }

  private void meetingReminders(List<MeetingRecord> meetings, Instant now, List<Candidate> out) {
    final Instant horizon = now.plus(policy.meetingLookahead());
    for (MeetingRecord meeting : meetings) {
      if (meeting.startsAt().isBefore(now) || meeting.startsAt().isAfter(horizon)) {
        continue;
      }
      final long minutes = Duration.between(now, meeting.startsAt()).toMinutes();
      out.add(
          new Candidate(
              NotificationPriority.HIGH,
              "Meeting starting soon: " + meeting.title(),
              "\"" + meeting.title() + "\" starts in " + minutes + " minute(s).",
              new NotificationPayload.MeetingReminder(
                  meeting.id(), meeting.title(), meeting.startsAt(), minutes)));
    }
  }

  private void staleTasks(List<TaskRecord> tasks, Instant now, List<Candidate> out) {
    final LocalDate today = now.atZone(policy.zone()).toLocalDate();
    final List<TaskRecord> stale =
        tasks.stream()
            .filter(task -> task.status() == TaskStatus.TODO)
            .filter(task -> task.deadline() != null)
            .filter(task -> task.deadline().atZone(policy.zone()).toLocalDate().equals(today))
            .toList();
    if (stale.isEmpty()) {
      return;
    }
    out.add(
        new Candidate(
            NotificationPriority.MEDIUM,
            stale.size() + " task(s) due today not started",
            "These tasks are due today and still marked as todo.",
            new NotificationPayload.StaleTasks(
                stale.stream().map(NotificationPayload.TaskRef::of).toList())));
  }

  private void scheduleConflicts(List<MeetingRecord> meetings, List<Candidate> out) {
    for (int i = 0; i < meetings.size(); i++) {
      for (int j = i + 1; j < meetings.size(); j++) {
        final MeetingRecord first = meetings.get(i);
        final MeetingRecord second = meetings.get(j);
        if (!first.overlaps(second)) {
          continue;
        }
        out.add(
            new Candidate(
                NotificationPriority.HIGH,
                "Schedule conflict",
                "\"" + first.title() + "\" overlaps with \"" + second.title() + "\".",
                new NotificationPayload.ScheduleConflict(
                    NotificationPayload.MeetingRef.of(first),
                    NotificationPayload.MeetingRef.of(second))));
      }
    }
  }

  private void workloadSpike(List<TaskRecord> tasks, Instant now, List<Candidate> out) {
    final Instant windowEnd = now.plus(policy.workloadWindow());
    final int due =
        (int)
            tasks.stream()
                .filter(TaskRecord::isOpen)
                .filter(task -> task.deadline() != null)
                .filter(task -> !task.deadline().isBefore(now) && task.deadline().isBefore(windowEnd))
                .count();
    final int threshold = policy.workloadSpikeThreshold();
    if (due < threshold) {
      return;
    }
    final int percentAbove = (due - threshold) * 100 / threshold;
    out.add(
        new Candidate(
            NotificationPriority.MEDIUM,
            "Workload spike",
            due + " open tasks are due in the next " + policy.workloadWindow().toDays() + " day(s).",
            new NotificationPayload.WorkloadSpike(
                due, threshold, percentAbove, policy.workloadWindow().toDays())));
  }
}
