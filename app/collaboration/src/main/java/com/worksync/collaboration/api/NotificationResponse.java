package com.worksync.collaboration.api;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import java.time.Instant;
import java.util.UUID;

@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record NotificationResponse(
    UUID id,
    String userId,
    String type,
    String priority,
    String title,
    String message,
    JsonNode data,
    boolean read,
    Instant readAt,
    Instant createdAt) {}
