package com.worksync.collaboration.digest;

import java.time.Instant;

public record ScheduleItem(Instant at, String kind, String title, String detail) {

  public static final String MEETING = "meeting";
  public static final String TASK = "task";
}
