/*
 * Where: digest scheduling
 * What: fires the four digest jobs on their cron expressions in the configured zone
 * Why: the generator owns the run; this class only decides when
 */
package com.worksync.collaboration.worker;

import com.worksync.collaboration.digest.DigestGenerator;
import com.worksync.collaboration.digest.DigestJob;
import java.time.Clock;
import java.time.Instant;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

@Component
@RequiredArgsConstructor
@ConditionalOnProperty(name = "collaboration.digest.enabled", havingValue = "true")
public class DigestWorker {

  private static final Logger logger = LoggerFactory.getLogger(DigestWorker.class);

  private final DigestGenerator generator;
  private final Clock clock;

  @Scheduled(cron = "${collaboration.digest.morning-cron}", zone = "${collaboration.digest.zone}")
  public void morningDigest() {
    fire(DigestJob.MORNING_DIGEST);
  }

  @Scheduled(cron = "${collaboration.digest.lunch-cron}", zone = "${collaboration.digest.zone}")
  public void lunchReminder() {
    fire(DigestJob.LUNCH_REMINDER);
  }

  @Scheduled(cron = "${collaboration.digest.end-of-day-cron}", zone = "${collaboration.digest.zone}")
  public void endOfDaySummary() {
    fire(DigestJob.END_OF_DAY_SUMMARY);
  }

  @Scheduled(cron = "${collaboration.digest.hourly-cron}", zone = "${collaboration.digest.zone}")
  public void hourlyCheck() {
    fire(DigestJob.HOURLY_CHECK);
  }

  void fire(DigestJob job) {
    try {
      generator.run(job, Instant.now(clock));
    } catch (RuntimeException ex) {
      logger.error("digest firing failed job={}", job.jobName(), ex);
    }
  }
}
