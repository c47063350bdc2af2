package com.worksync.collaboration.model;

import java.time.Instant;

/** Read-only view of a task owned by the CRUD layer. {@code deadline} may be null. */
public record TaskRecord(
    String id,
    String projectId,
    String title,
    TaskStatus status,
    TaskPriority priority,
    String assigneeId,
    Instant deadline,
    Instant updatedAt) {

  public boolean isOpen() {
    return status != TaskStatus.DONE;
  }
}
