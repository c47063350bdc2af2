package com.worksync.collaboration.model;

import java.util.Locale;

public enum TaskPriority {
  LOW,
  MEDIUM,
  HIGH,
  URGENT;

  public boolean isHighOrAbove() {
    return this == HIGH || this == URGENT;
  }

  public static TaskPriority fromWireValue(String value) {
    return valueOf(value.toUpperCase(Locale.ROOT));
  }
}
