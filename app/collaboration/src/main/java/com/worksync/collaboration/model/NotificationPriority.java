package com.worksync.collaboration.model;

import java.util.Locale;

public enum NotificationPriority {
  LOW,
  MEDIUM,
  HIGH,
  URGENT;

  public String wireValue() {
    return name().toLowerCase(Locale.ROOT);
  }

  public static NotificationPriority fromWireValue(String value) {
    return valueOf(value.toUpperCase(Locale.ROOT));
  }
}
