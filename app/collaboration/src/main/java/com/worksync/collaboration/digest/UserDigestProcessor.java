/*
 * Where: digest pipeline
 * What: one user's share of a digest firing: evaluate, push urgent items, mail the rest
 * Why: the generator runs this per user on its worker pool and isolates failures around it
 */
package com.worksync.collaboration.digest;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.worksync.collaboration.config.DigestProperties;
import com.worksync.collaboration.model.DigestRecipient;
import com.worksync.collaboration.model.MeetingRecord;
import com.worksync.collaboration.model.NotificationPriority;
import com.worksync.collaboration.model.NotificationRecord;
import com.worksync.collaboration.model.TaskRecord;
import com.worksync.collaboration.model.UserPreferences;
import com.worksync.collaboration.repository.NotificationHistoryRepository;
import com.worksync.collaboration.repository.WorkloadRepository;
import com.worksync.collaboration.service.NotificationPublication;
import com.worksync.collaboration.service.NotificationService;
import java.time.Duration;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneId;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

@Component
@RequiredArgsConstructor
public class UserDigestProcessor {

    private static final Logger logger = LoggerFactory.getLogger(UserDigestProcessor.class);

    static final String URGENT_ALERT_HISTORY_TYPE = "urgent_alert";
    static final int PENDING_NOTIFICATION_LIMIT = 5;

    private final WorkloadRepository workloadRepository;
    private final TriggerEvaluator triggerEvaluator;
    private final NotificationService notificationService;
    private final DigestEmailRenderer renderer;
    private final DigestMailSender mailSender;
    private final NotificationHistoryRepository historyRepository;
    private final DigestProperties properties;
    private final ObjectMapper objectMapper;

    /**
     * Runs the user's part of a firing. Anything thrown here counts the user as failed; urgent
     * notifications already stored stay stored.
     */
    public UserDigestResult process(DigestJob job, DigestRecipient recipient, String windowKey, Instant now) {
        final ZoneId zone = properties.zoneId();
        final LocalDate today = now.atZone(zone).toLocalDate();
        final LocalDate focusDay = today.plusDays(job.focusDayOffset());
        final Instant todayStart = today.atStartOfDay(zone).toInstant();
        final Instant focusEnd = focusDay.plusDays(1).atStartOfDay(zone).toInstant();
        final Instant lookaheadEnd = now.plus(properties.meetingLookahead());

        final List<TaskRecord> tasks = workloadRepository.findOpenTasksAssignedTo(recipient.userId());
        final List<MeetingRecord> meetings = workloadRepository.findMeetingsForAttendee(
                recipient.userId(), todayStart, focusEnd.isAfter(lookaheadEnd) ? focusEnd : lookaheadEnd);

        final List<Candidate> candidates =
                filterByPreferences(triggerEvaluator.evaluate(tasks, meetings, now), recipient.preferences());

        int urgentPushed = 0;
        int urgentMailed = 0;
        final List<Candidate> digestItems = new ArrayList<>();
        for (Candidate candidate : candidates) {
            if (candidate.isUrgent()) {
                final NotificationPublication publication = notificationService.create(
                        recipient.userId(),
                        candidate.title(),
                        candidate.message(),
                        candidate.payload(),
                        NotificationPriority.URGENT);
                if (publication.delivery().reachedAny()) {
                    urgentPushed++;
                } else {
                    sendUrgentAlert(recipient, candidate, windowKey, now);
                    urgentMailed++;
                }
            } else if (!recipient.preferences().urgentOnly()) {
                digestItems.add(candidate);
            }
        }

        final DigestSummary summary = job.isSummaryDigest()
                ? summarize(job, recipient.userId(), tasks, meetings, today, focusDay, now)
                : null;
        final boolean summaryWorthSending = summary != null && !summary.isEmpty();
        boolean digestSent = false;
        if (!digestItems.isEmpty() || summaryWorthSending) {
            final DigestEmail email =
                    renderer.renderDigest(job, recipient, summaryWorthSending ? summary : null, digestItems);
            mailSender.send(email);
            historyRepository.insert(
                    recipient.userId(), job.jobName(), windowKey, historyData(digestItems, summary), now);
            digestSent = true;
        }

        logger.debug("digest processed job={} userId={} candidates={} urgentPushed={} urgentMailed={} digestSent={}",
                job.jobName(), recipient.userId(), candidates.size(), urgentPushed, urgentMailed, digestSent);
        return new UserDigestResult(recipient.userId(), candidates.size(), urgentPushed, urgentMailed, digestSent);
    }

    static List<Candidate> filterByPreferences(List<Candidate> candidates, UserPreferences preferences) {
        return candidates.stream()
                .filter(candidate -> switch (candidate.kind()) {
                    case MEETING_REMINDER, SCHEDULE_CONFLICT -> preferences.meetingReminders();
                    case OVERDUE_TASKS, STALE_TASKS, WORKLOAD_SPIKE -> preferences.taskReminders();
                    default -> true;
                })
                .toList();
    }

    DigestSummary summarize(
            DigestJob job,
            String userId,
            List<TaskRecord> tasks,
            List<MeetingRecord> meetings,
            LocalDate today,
            LocalDate focusDay,
            Instant now) {
        final ZoneId zone = properties.zoneId();
        final Instant focusStart = focusDay.atStartOfDay(zone).toInstant();
        final Instant focusEnd = focusDay.plusDays(1).atStartOfDay(zone).toInstant();
        final Instant upcomingEnd = focusEnd.plus(Duration.ofDays(properties.upcomingDeadlineDays()));

        final List<ScheduleItem> schedule = new ArrayList<>();
        int tasksDue = 0;
        int upcomingDeadlines = 0;
        int highPriority = 0;
        for (TaskRecord task : tasks) {
            if (!task.isOpen()) {
                continue;
            }
            if (task.priority() != null && task.priority().isHighOrAbove()) {
                highPriority++;
            }
            if (task.deadline() == null) {
                continue;
            }
            if (within(task.deadline(), focusStart, focusEnd)) {
                tasksDue++;
                schedule.add(new ScheduleItem(task.deadline(), ScheduleItem.TASK, task.title(),
                        "due, " + priorityLabel(task) + " priority"));
            } else if (within(task.deadline(), focusEnd, upcomingEnd)) {
                upcomingDeadlines++;
            }
        }

        int meetingCount = 0;
        for (MeetingRecord meeting : meetings) {
            if (!meeting.isCancelled() && within(meeting.startsAt(), focusStart, focusEnd)) {
                meetingCount++;
                schedule.add(new ScheduleItem(meeting.startsAt(), ScheduleItem.MEETING, meeting.title(),
                        meeting.durationMinutes() + " min"));
            }
        }
        schedule.sort(Comparator.comparing(ScheduleItem::at).thenComparing(ScheduleItem::title));

        final int completedToday = job == DigestJob.END_OF_DAY_SUMMARY
                ? workloadRepository.countCompletedBetween(userId, today.atStartOfDay(zone).toInstant(), now)
                : 0;
        long unread = 0;
        final List<DigestSummary.PendingNotification> pending = new ArrayList<>();
        if (job == DigestJob.MORNING_DIGEST) {
            for (NotificationRecord record : notificationService.latestUnread(userId, PENDING_NOTIFICATION_LIMIT)) {
                pending.add(new DigestSummary.PendingNotification(
                        record.title(), record.message(), record.priority().wireValue()));
            }
            unread = pending.isEmpty() ? 0 : notificationService.unreadCount(userId);
        }
        return new DigestSummary(focusDay, tasksDue, meetingCount, upcomingDeadlines, highPriority,
                completedToday, schedule, unread, pending);
    }

    private void sendUrgentAlert(DigestRecipient recipient, Candidate candidate, String windowKey, Instant now) {
        mailSender.send(renderer.renderUrgentAlert(recipient, candidate));
        historyRepository.insert(
                recipient.userId(), URGENT_ALERT_HISTORY_TYPE, windowKey, historyData(List.of(candidate), null), now);
        logger.info("urgent alert mailed, no live connection received it userId={} kind={}",
                recipient.userId(), candidate.kind().wireValue());
    }

    private String historyData(List<Candidate> candidates, DigestSummary summary) {
        final Map<String, Object> data = new LinkedHashMap<>();
        data.put("items", candidates.stream().map(candidate -> Map.of(
                "kind", candidate.kind().wireValue(),
                "priority", candidate.priority().wireValue(),
                "title", candidate.title())).toList());
        if (summary != null) {
            data.put("summary", summary);
        }
        try {
            return objectMapper.writeValueAsString(data);
        } catch (JsonProcessingException ex) {
            throw new IllegalStateException("digest history data is not serializable", ex);
        }
    }

    private static boolean within(Instant value, Instant fromInclusive, Instant toExclusive) {
        return !value.isBefore(fromInclusive) && value.isBefore(toExclusive);
    }

    private static String priorityLabel(TaskRecord task) {
        return task.priority() == null ? "medium" : task.priority().name().toLowerCase(Locale.ROOT);
    }
}
