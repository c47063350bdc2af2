package com.worksync.collaboration.model;

import java.time.Duration;
import java.time.Instant;

public record MeetingRecord(
    String id,
    String projectId,
    String title,
    Instant startsAt,
    int durationMinutes,
    String status) {

  public Instant endsAt() {
    return startsAt.plus(Duration.ofMinutes(durationMinutes));
  }

  public boolean isCancelled() {
    return "cancelled".equals(status);
  }

  public boolean overlaps(MeetingRecord other) {
    return startsAt.isBefore(other.endsAt()) && other.startsAt.isBefore(endsAt());
  }
}
