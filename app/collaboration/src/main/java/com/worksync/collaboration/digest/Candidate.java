package com.worksync.collaboration.digest;

import com.worksync.collaboration.model.NotificationPayload;
import com.worksync.collaboration.model.NotificationPriority;
import com.worksync.collaboration.model.NotificationType;

/** A notification the evaluator thinks the user should receive. */
public record Candidate(
    NotificationPriority priority, String title, String message, NotificationPayload payload) {

  public NotificationType kind() {
    return payload.type();
  }

  public boolean isUrgent() {
    return priority == NotificationPriority.URGENT;
  }
}
