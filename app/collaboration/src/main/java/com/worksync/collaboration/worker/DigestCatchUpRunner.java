/*
 * Where: digest scheduling
 * What: on startup, runs the latest firing of each job that was missed while the service was down
 * Why: a restart across 07:00 should not cost everyone their morning digest
 */
package com.worksync.collaboration.worker;

import com.worksync.collaboration.config.DigestProperties;
import com.worksync.collaboration.digest.DigestGenerator;
import com.worksync.collaboration.digest.DigestJob;
import com.worksync.collaboration.repository.DigestJobRunRepository;
import java.time.Clock;
import java.time.Duration;
import java.time.ZonedDateTime;
import java.util.Optional;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;
import org.springframework.scheduling.support.CronExpression;
import org.springframework.stereotype.Component;

@Component
@RequiredArgsConstructor
@ConditionalOnProperty(name = "collaboration.digest.enabled", havingValue = "true")
public class DigestCatchUpRunner {

  private static final Logger logger = LoggerFactory.getLogger(DigestCatchUpRunner.class);

  private final DigestGenerator generator;
  private final DigestJobRunRepository jobRunRepository;
  private final DigestProperties properties;
  private final Clock clock;

  @EventListener(ApplicationReadyEvent.class)
  public void catchUp() {
    final ZonedDateTime now = ZonedDateTime.now(clock.withZone(properties.zoneId()));
    for (DigestJob job : DigestJob.values()) {
      try {
        lastFiringWithin(CronExpression.parse(job.cron(properties)), now, properties.catchUpGrace())
            .ifPresent(missed -> runIfMissing(job, missed));
      } catch (RuntimeException ex) {
        logger.error("digest catch-up failed job={}", job.jobName(), ex);
      }
    }
  }

  private void runIfMissing(DigestJob job, ZonedDateTime firing) {
    final String windowKey = generator.windowKey(firing.toInstant());
    if (jobRunRepository.exists(job.jobName(), windowKey)) {
      return;
    }
    logger.info("digest catch-up running missed firing job={} window={}", job.jobName(), windowKey);
    generator.run(job, firing.toInstant());
  }

  /** Most recent firing in {@code (now - grace, now]}, if any. */
  static Optional<ZonedDateTime> lastFiringWithin(CronExpression cron, ZonedDateTime now, Duration grace) {
    ZonedDateTime last = null;
    ZonedDateTime next = cron.next(now.minus(grace));
    while (next != null && !next.isAfter(now)) {
      last = next;
      next = cron.next(next);
    }
    return Optional.ofNullable(last);
  }
}
