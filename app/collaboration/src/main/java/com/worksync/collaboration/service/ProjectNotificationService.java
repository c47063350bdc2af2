/*
 * Where: collaboration service layer
 * What: entry points the CRUD layer calls after task, comment and meeting changes
 * Why: recipients are resolved here from ownership and membership, never taken from the caller
 */
package com.worksync.collaboration.service;

import com.worksync.collaboration.model.NotificationPayload;
import com.worksync.collaboration.model.NotificationPriority;
import com.worksync.collaboration.model.NotificationRecord;
import com.worksync.collaboration.model.TaskRecord;
import com.worksync.collaboration.repository.ProjectAccessRepository;
import com.worksync.collaboration.repository.WorkloadRepository;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

@Service
@RequiredArgsConstructor
public class ProjectNotificationService {

    private static final Logger logger = LoggerFactory.getLogger(ProjectNotificationService.class);

    private final NotificationService notificationService;
    private final ProjectAccessRepository projectAccessRepository;
    private final WorkloadRepository workloadRepository;

    /** Tells the assignee, and the project owner as well when the task went to someone else. */
    public NotificationPublication notifyTaskAssigned(
            String taskId,
            String projectId,
            String assigneeId,
            String assigneeName,
            String assignerName,
            String taskTitle) {
        final NotificationPublication publication = notificationService.create(
                assigneeId,
                "New Task Assigned",
                assignerName + " assigned you a task: " + taskTitle,
                new NotificationPayload.TaskAssigned(taskId, taskTitle, assignerName),
                NotificationPriority.MEDIUM);
        projectAccessRepository.findOwnerId(projectId)
                .filter(ownerId -> !ownerId.equals(assigneeId))
                .ifPresent(ownerId -> notificationService.create(
                        ownerId,
                        "Task Assigned in Your Project",
                        assignerName + " assigned " + taskTitle + " to " + assigneeName,
                        new NotificationPayload.TaskAssignedInProject(
                                taskId, projectId, taskTitle, assigneeId, assigneeName, assignerName),
                        NotificationPriority.LOW));
        return publication;
    }

    /** Everyone on the project except the user who made the change. */
    public List<NotificationRecord> notifyTaskUpdated(
            String taskId, String projectId, String updatedByUserId, String updaterName, String taskTitle) {
        final List<String> recipients = projectRecipients(projectId);
        recipients.remove(updatedByUserId);
        return notificationService.createBulk(
                recipients,
                "Task Updated",
                updaterName + " updated task: " + taskTitle,
                new NotificationPayload.TaskUpdated(taskId, projectId, taskTitle, updaterName),
                NotificationPriority.LOW);
    }

    /** Project members, owner and the task's assignee, minus the commenter. */
    public List<NotificationRecord> notifyCommentAdded(
            String taskId, String commenterUserId, String commenterName) {
        final TaskRecord task = workloadRepository.findTask(taskId)
                .orElseThrow(() -> new IllegalArgumentException("task not found: " + taskId));
        final List<String> recipients = projectRecipients(task.projectId());
        if (task.assigneeId() != null && !recipients.contains(task.assigneeId())) {
            recipients.add(task.assigneeId());
        }
        recipients.remove(commenterUserId);
        return notificationService.createBulk(
                recipients,
                "New Comment",
                commenterName + " commented on: " + task.title(),
                new NotificationPayload.CommentAdded(taskId, task.title(), commenterName),
                NotificationPriority.LOW);
    }

    public NotificationPublication notifyDeadlineApproaching(
            String taskId, String userId, String taskTitle, Instant deadline) {
        return notificationService.create(
                userId,
                "Deadline Approaching",
                "Task \"" + taskTitle + "\" is due " + deadline,
                new NotificationPayload.DeadlineApproaching(taskId, taskTitle, deadline),
                NotificationPriority.HIGH);
    }

    /** Attendees outside the project are dropped. */
    public List<NotificationRecord> notifyMeetingScheduled(
            String meetingId, String projectId, List<String> attendeeIds, String meetingTitle, Instant scheduledAt) {
        final List<String> members = projectRecipients(projectId);
        final List<String> recipients = new ArrayList<>();
        for (String attendeeId : attendeeIds) {
            if (members.contains(attendeeId)) {
                recipients.add(attendeeId);
            } else {
                logger.warn("meeting attendee is not a project member meetingId={} projectId={} userId={}",
                        meetingId, projectId, attendeeId);
            }
        }
        return notificationService.createBulk(
                recipients,
                "Meeting Scheduled",
                "New meeting: " + meetingTitle + " at " + scheduledAt,
                new NotificationPayload.MeetingScheduled(meetingId, meetingTitle, scheduledAt),
                NotificationPriority.MEDIUM);
    }

    public List<NotificationRecord> notifyProjectMilestone(
            String projectId, String milestoneTitle, String description) {
        return notifyProjectTeam(
                projectId,
                "Project Milestone Reached",
                "Milestone reached: " + milestoneTitle,
                new NotificationPayload.ProjectMilestone(projectId, milestoneTitle, description),
                NotificationPriority.MEDIUM);
    }

    public List<NotificationRecord> notifyProjectDeadline(String projectId, String deadlineTitle, Instant dueAt) {
        return notifyProjectTeam(
                projectId,
                "Project Deadline Approaching",
                deadlineTitle + " is due " + dueAt,
                new NotificationPayload.ProjectDeadline(projectId, deadlineTitle, dueAt),
                NotificationPriority.HIGH);
    }

    public List<NotificationRecord> notifyProjectUpdate(
            String projectId, String updateTitle, String summary, String updaterName) {
        return notifyProjectTeam(
                projectId,
                "Project Update",
                updaterName + " posted an update: " + updateTitle,
                new NotificationPayload.ProjectUpdate(projectId, updateTitle, summary, updaterName),
                NotificationPriority.LOW);
    }

    /** Owner and every member, the author included. */
    private List<NotificationRecord> notifyProjectTeam(
            String projectId,
            String title,
            String message,
            NotificationPayload payload,
            NotificationPriority priority) {
        final List<String> recipients = projectRecipients(projectId);
        if (recipients.isEmpty()) {
            logger.info("project has no team to notify projectId={} type={}", projectId, payload.type().wireValue());
            return List.of();
        }
        return notificationService.createBulk(recipients, title, message, payload, priority);
    }

    private List<String> projectRecipients(String projectId) {
        return new ArrayList<>(projectAccessRepository.findRecipientUserIds(projectId));
    }
}
