package com.worksync.collaboration.digest;

import com.worksync.collaboration.config.DigestProperties;
import java.time.Duration;
import java.time.ZoneId;

/** Thresholds for {@link TriggerEvaluator}. {@code zone} decides what "today" means. */
public record TriggerPolicy(
    ZoneId zone, Duration meetingLookahead, Duration workloadWindow, int workloadSpikeThreshold) {

  public static TriggerPolicy from(DigestProperties properties) {
    return new TriggerPolicy(
        properties.zoneId(),
        properties.meetingLookahead(),
        properties.workloadWindow(),
        properties.workloadSpikeThreshold());
  }
}
