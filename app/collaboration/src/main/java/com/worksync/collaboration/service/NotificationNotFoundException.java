package com.worksync.collaboration.service;

import java.util.UUID;

/** Raised for unknown ids and for ids owned by another user alike. */
public class NotificationNotFoundException extends RuntimeException {

  public NotificationNotFoundException(UUID notificationId) {
    super("notification not found: " + notificationId);
  }
}
