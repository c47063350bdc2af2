package com.worksync.collaboration.model;

import java.util.Locale;

public enum TaskStatus {
  TODO,
  IN_PROGRESS,
  REVIEW,
  DONE;

  public static TaskStatus fromWireValue(String value) {
    return valueOf(value.toUpperCase(Locale.ROOT));
  }
}
