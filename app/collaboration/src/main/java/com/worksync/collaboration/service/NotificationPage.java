package com.worksync.collaboration.service;

import com.worksync.collaboration.model.NotificationRecord;
import java.util.List;

public record NotificationPage(int page, int limit, long total, List<NotificationRecord> notifications) {

  public NotificationPage {
    notifications = List.copyOf(notifications);
  }
}
