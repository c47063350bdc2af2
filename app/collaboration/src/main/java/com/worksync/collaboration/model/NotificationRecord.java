package com.worksync.collaboration.model;

import java.time.Instant;
import java.util.UUID;

/** One persisted notification for one recipient. {@code dataJson} is the serialized payload. */
public record NotificationRecord(
    UUID id,
    String userId,
    NotificationType type,
    String title,
    String message,
    NotificationPriority priority,
    String dataJson,
    boolean read,
    Instant readAt,
    Instant createdAt) {}
