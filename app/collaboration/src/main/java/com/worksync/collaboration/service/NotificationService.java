/*
 * Where: collaboration service layer
 * What: durable notification store; records first, then pushes to the recipient's user room
 * Why: a recipient who is offline still finds the record later, and a failed push never undoes it
 */
package com.worksync.collaboration.service;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.google.common.annotations.VisibleForTesting;
import com.worksync.collaboration.model.NotificationPayload;
import com.worksync.collaboration.model.NotificationPriority;
import com.worksync.collaboration.model.NotificationRecord;
import com.worksync.collaboration.realtime.BroadcastDispatcher;
import com.worksync.collaboration.realtime.DeliveryOutcome;
import com.worksync.collaboration.realtime.OutboundEvent;
import com.worksync.collaboration.realtime.RoomIds;
import com.worksync.collaboration.repository.NotificationRepository;
import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.support.TransactionTemplate;

@Service
@RequiredArgsConstructor
public class NotificationService {

    private static final Logger logger = LoggerFactory.getLogger(NotificationService.class);
    static final int MAX_PAGE_SIZE = 100;

    private final NotificationRepository notificationRepository;
    private final BroadcastDispatcher dispatcher;
    private final CollaborationMetrics metrics;
    private final ObjectMapper objectMapper;
    private final Clock clock;
    private final PlatformTransactionManager transactionManager;

    public NotificationPublication create(
            String userId,
            String title,
            String message,
            NotificationPayload payload,
            NotificationPriority priority) {
        requireUserId(userId);
        final NotificationRecord record = newRecord(userId, title, message, payload, priority, serialize(payload));
        try {
            new TransactionTemplate(transactionManager).executeWithoutResult(
                    status -> notificationRepository.insert(record));
        } catch (DataAccessException ex) {
            throw new NotificationPersistenceException(
                    "notification insert failed userId=" + userId + " type=" + payload.type().wireValue(), ex);
        }
        metrics.recordNotificationsCreated(payload.type().wireValue(), 1);
        final DeliveryOutcome outcome = pushQuietly(record);
        return new NotificationPublication(record, outcome);
    }

    /**
     * One record per distinct recipient, written in a single transaction. Duplicate ids are
     * collapsed keeping first-seen order. Nothing is pushed unless every row committed.
     */
    public List<NotificationRecord> createBulk(
            List<String> userIds,
            String title,
            String message,
            NotificationPayload payload,
            NotificationPriority priority) {
        final Set<String> recipients = new LinkedHashSet<>();
        for (String userId : userIds) {
            recipients.add(requireUserId(userId));
        }
        if (recipients.isEmpty()) {
            return List.of();
        }
        final String dataJson = serialize(payload);
        final List<NotificationRecord> records = new ArrayList<>(recipients.size());
        for (String userId : recipients) {
            records.add(newRecord(userId, title, message, payload, priority, dataJson));
        }
        try {
            new TransactionTemplate(transactionManager).executeWithoutResult(
                    status -> notificationRepository.insertAll(records));
        } catch (DataAccessException ex) {
            throw new NotificationPersistenceException(
                    "notification bulk insert failed recipients=" + records.size()
                            + " type=" + payload.type().wireValue(), ex);
        }
        metrics.recordNotificationsCreated(payload.type().wireValue(), records.size());
        for (NotificationRecord record : records) {
            pushQuietly(record);
        }
        return List.copyOf(records);
    }

    public NotificationRecord markRead(UUID notificationId, String userId) {
        return updateReadState(notificationId, userId, true);
    }

    public NotificationRecord updateReadState(UUID notificationId, String userId, boolean read) {
        final Optional<NotificationRecord> updated;
        try {
            updated = notificationRepository.updateReadState(notificationId, userId, read, Instant.now(clock));
        } catch (DataAccessException ex) {
            throw new NotificationPersistenceException(
                    "notification read state update failed id=" + notificationId + " userId=" + userId, ex);
        }
        return updated.orElseThrow(() -> new NotificationNotFoundException(notificationId));
    }

    public int markAllRead(String userId) {
        try {
            return notificationRepository.markAllRead(userId, Instant.now(clock));
        } catch (DataAccessException ex) {
            throw new NotificationPersistenceException("mark all read failed userId=" + userId, ex);
        }
    }

    public void delete(UUID notificationId, String userId) {
        final int deleted;
        try {
            deleted = notificationRepository.delete(notificationId, userId);
        } catch (DataAccessException ex) {
            throw new NotificationPersistenceException(
                    "notification delete failed id=" + notificationId + " userId=" + userId, ex);
        }
        if (deleted == 0) {
            throw new NotificationNotFoundException(notificationId);
        }
    }

    /** Newest first. {@code page} starts at 1. */
    public NotificationPage list(String userId, int page, int limit) {
        if (page < 1) {
            throw new IllegalArgumentException("page must be >= 1");
        }
        if (limit < 1 || limit > MAX_PAGE_SIZE) {
            throw new IllegalArgumentException("limit must be between 1 and " + MAX_PAGE_SIZE);
        }
        final long offset = (long) (page - 1) * limit;
        if (offset > Integer.MAX_VALUE) {
            throw new IllegalArgumentException("page is out of range");
        }
        try {
            final List<NotificationRecord> records =
                    notificationRepository.findPageByUserId(userId, limit, (int) offset);
            final long total = notificationRepository.countByUserId(userId);
            return new NotificationPage(page, limit, total, records);
        } catch (DataAccessException ex) {
            throw new NotificationPersistenceException("notification list failed userId=" + userId, ex);
        }
    }

    public long unreadCount(String userId) {
        try {
            return notificationRepository.countUnread(userId);
        } catch (DataAccessException ex) {
            throw new NotificationPersistenceException("unread count failed userId=" + userId, ex);
        }
    }

    public List<NotificationRecord> latestUnread(String userId, int limit) {
        try {
            return notificationRepository.findUnreadByUserId(userId, limit);
        } catch (DataAccessException ex) {
            throw new NotificationPersistenceException("unread lookup failed userId=" + userId, ex);
        }
    }

    @VisibleForTesting
    DeliveryOutcome pushQuietly(NotificationRecord record) {
        try {
            final JsonNode data = objectMapper.readTree(record.dataJson());
            return dispatcher.deliverToUser(record.userId(), OutboundEvent.notification(record, data));
        } catch (JsonProcessingException | RuntimeException ex) {
            logger.warn("notification push failed id={} userId={}", record.id(), record.userId(), ex);
            return DeliveryOutcome.empty(RoomIds.user(record.userId()));
        }
    }

    private NotificationRecord newRecord(
            String userId,
            String title,
            String message,
            NotificationPayload payload,
            NotificationPriority priority,
            String dataJson) {
        return new NotificationRecord(
                UUID.randomUUID(),
                userId,
                payload.type(),
                title,
                message,
                priority,
                dataJson,
                false,
                null,
                Instant.now(clock));
    }

    private String serialize(NotificationPayload payload) {
        try {
            return objectMapper.writeValueAsString(payload);
        } catch (JsonProcessingException ex) {
            throw new IllegalArgumentException("payload is not serializable type=" + payload.type().wireValue(), ex);
        }
    }

    private static String requireUserId(String userId) {
        if (userId == null || userId.isBlank()) {
            throw new IllegalArgumentException("userId must not be blank");
        }
        return userId;
    }
}
