package com.worksync.collaboration.api;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import java.util.List;

@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record NotificationPageResponse(
    int page, int limit, long total, List<NotificationResponse> notifications) {

  public NotificationPageResponse {
    notifications = notifications == null ? List.of() : List.copyOf(notifications);
  }
}
