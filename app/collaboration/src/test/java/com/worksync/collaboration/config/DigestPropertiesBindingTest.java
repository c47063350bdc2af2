/*
 * Where: collaboration configuration tests
 * What: binds the digest schedule and thresholds and rejects malformed values
 * Why: a bad cron or zone must stop startup instead of silently never firing
 */
package com.worksync.collaboration.config;

import static org.assertj.core.api.Assertions.assertThat;

import java.time.Duration;
import java.time.ZoneId;
import org.junit.jupiter.api.Test;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.boot.context.properties.bind.validation.BindValidationException;
import org.springframework.boot.test.context.assertj.AssertableApplicationContext;
import org.springframework.boot.test.context.runner.ApplicationContextRunner;
import org.springframework.boot.test.context.runner.ContextConsumer;
import org.springframework.context.annotation.Configuration;

class DigestPropertiesBindingTest {

  private final ApplicationContextRunner contextRunner =
      new ApplicationContextRunner()
          .withUserConfiguration(TestConfiguration.class)
          .withPropertyValues(
              "collaboration.digest.enabled=true",
              "collaboration.digest.zone=Europe/Berlin",
              "collaboration.digest.morning-cron=0 0 7 * * *",
              "collaboration.digest.lunch-cron=0 0 12 * * *",
              "collaboration.digest.end-of-day-cron=0 0 17 * * *",
              "collaboration.digest.hourly-cron=0 0 9-18 * * *",
              "collaboration.digest.worker-threads=4",
              "collaboration.digest.per-user-timeout=30s",
              "collaboration.digest.run-deadline=20m",
              "collaboration.digest.catch-up-grace=2h",
              "collaboration.digest.meeting-lookahead=30m",
              "collaboration.digest.upcoming-deadline-days=3",
              "collaboration.digest.workload-spike-threshold=8",
              "collaboration.digest.workload-window=7d",
              "collaboration.mail.transport=log",
              "collaboration.mail.from-address=notifications@worksync.test",
              "collaboration.mail.app-url=https://app.worksync.test");

  @Test
  void bindsDurationsAndZone() {
    contextRunner.run(
        context -> {
          assertThat(context).hasNotFailed();
          final DigestProperties properties = context.getBean(DigestProperties.class);

          assertThat(properties.zoneId()).isEqualTo(ZoneId.of("Europe/Berlin"));
          assertThat(properties.perUserTimeout()).isEqualTo(Duration.ofSeconds(30));
          assertThat(properties.runDeadline()).isEqualTo(Duration.ofMinutes(20));
          assertThat(properties.catchUpGrace()).isEqualTo(Duration.ofHours(2));
          assertThat(properties.workloadWindow()).isEqualTo(Duration.ofDays(7));
          assertThat(properties.hourlyCron()).isEqualTo("0 0 9-18 * * *");
          assertThat(context.getBean(DigestMailProperties.class).transport()).isEqualTo("log");
        });
  }

  @Test
  void rejectsInvalidCron() {
    contextRunner
        .withPropertyValues("collaboration.digest.lunch-cron=every noon")
        .run(assertValidationFailure("cron"));
  }

  @Test
  void rejectsUnknownZone() {
    contextRunner
        .withPropertyValues("collaboration.digest.zone=Mars/Olympus")
        .run(assertValidationFailure("zone"));
  }

  @Test
  void rejectsZeroTimeout() {
    contextRunner
        .withPropertyValues("collaboration.digest.per-user-timeout=0s")
        .run(assertValidationFailure("durations"));
  }

  @Test
  void rejectsUnknownMailTransport() {
    contextRunner
        .withPropertyValues("collaboration.mail.transport=carrier-pigeon")
        .run(assertValidationFailure("transport"));
  }

  private ContextConsumer<AssertableApplicationContext> assertValidationFailure(
      String expectedField) {
    return context -> {
      assertThat(context).hasFailed();
      final Throwable root =
          org.assertj.core.util.Throwables.getRootCause(context.getStartupFailure());
      assertThat(root).isInstanceOf(BindValidationException.class);
      assertThat(root.getMessage()).contains(expectedField);
    };
  }

  @Configuration
  @EnableConfigurationProperties({DigestProperties.class, DigestMailProperties.class})
  static class TestConfiguration {}
}
