package com.worksync.collaboration.model;

import java.time.Instant;

/** Ledger row for one firing of a scheduled digest job. */
public record DigestJobRun(
    String jobName,
    String windowKey,
    Instant firedAt,
    Instant completedAt,
    int usersProcessed,
    int usersFailed,
    int usersSkipped) {}
