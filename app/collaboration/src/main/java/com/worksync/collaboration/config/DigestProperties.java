/*
 * Where: collaboration service configuration
 * What: cron expressions, worker pool size, timeouts and trigger thresholds of the digest jobs
 * Why: schedules and limits differ between environments and must fail fast when malformed
 */
package com.worksync.collaboration.config;

import jakarta.validation.constraints.AssertTrue;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import java.time.DateTimeException;
import java.time.Duration;
import java.time.ZoneId;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.scheduling.support.CronExpression;
import org.springframework.validation.annotation.Validated;

@ConfigurationProperties(prefix = "collaboration.digest")
@Validated
public record DigestProperties(
    boolean enabled,
    @NotBlank String zone,
    @NotBlank String morningCron,
    @NotBlank String lunchCron,
    @NotBlank String endOfDayCron,
    @NotBlank String hourlyCron,
    @Positive int workerThreads,
    @NotNull Duration perUserTimeout,
    @NotNull Duration runDeadline,
    @NotNull Duration catchUpGrace,
    @NotNull Duration meetingLookahead,
    @Positive int upcomingDeadlineDays,
    @Positive int workloadSpikeThreshold,
    @NotNull Duration workloadWindow) {

  public ZoneId zoneId() {
    return ZoneId.of(zone);
  }

  @AssertTrue(message = "collaboration.digest.zone must be a valid zone id")
  public boolean isZoneValid() {
    if (zone == null || zone.isBlank()) {
      return true;
    }
    try {
      ZoneId.of(zone);
      return true;
    } catch (DateTimeException ex) {
      return false;
    }
  }

  @AssertTrue(message = "collaboration.digest cron expressions must be valid")
  public boolean isCronValid() {
    return isValidCron(morningCron)
        && isValidCron(lunchCron)
        && isValidCron(endOfDayCron)
        && isValidCron(hourlyCron);
  }

  @AssertTrue(message = "collaboration.digest durations must be positive")
  public boolean isDurationsPositive() {
    return isPositive(perUserTimeout)
        && isPositive(runDeadline)
        && isPositive(catchUpGrace)
        && isPositive(meetingLookahead)
        && isPositive(workloadWindow);
  }

  private static boolean isValidCron(String expression) {
    return expression == null || expression.isBlank() || CronExpression.isValidExpression(expression);
  }

  private static boolean isPositive(Duration duration) {
    return duration == null || (!duration.isZero() && !duration.isNegative());
  }
}
