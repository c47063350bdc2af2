package com.worksync.collaboration.digest;

import java.time.Instant;

/**
 * Counters of one firing. {@code claimed} is false when another firing already owned the window,
 * in which case every counter is zero.
 */
public record DigestRunResult(
    DigestJob job,
    String windowKey,
    boolean claimed,
    int processed,
    int failed,
    int skipped,
    Instant completedAt) {

  public static DigestRunResult notClaimed(DigestJob job, String windowKey) {
    return new DigestRunResult(job, windowKey, false, 0, 0, 0, null);
  }

  public int total() {
    return processed + failed + skipped;
  }
}
