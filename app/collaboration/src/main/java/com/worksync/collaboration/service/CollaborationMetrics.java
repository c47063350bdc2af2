/*
 * Where: collaboration service layer
 * What: live connection gauge, fan-out outcomes, notification writes and digest run results
 * Why: delivery health is only observable through counters since pushes are fire-and-forget
 */
package com.worksync.collaboration.service;

import com.worksync.collaboration.realtime.ConnectionRegistry;
import edu.umd.cs.findbugs.annotations.SuppressFBWarnings;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Tags;
import io.micrometer.core.instrument.Timer;
import java.time.Duration;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import org.springframework.stereotype.Component;

@Component
@SuppressFBWarnings(
    value = "EI_EXPOSE_REP2",
    justification = "MeterRegistry and ConnectionRegistry are shared Spring singletons")
public class CollaborationMetrics {

  private static final String METRIC_CONNECTIONS_CURRENT = "collaboration.connections.current";
  private static final String METRIC_DELIVERY_TOTAL = "collaboration.delivery.total";
  private static final String METRIC_NOTIFICATION_CREATED = "collaboration.notification.created.total";
  private static final String METRIC_DIGEST_USERS = "collaboration.digest.users.total";
  private static final String METRIC_DIGEST_RUN = "collaboration.digest.run.duration";

  private final MeterRegistry meterRegistry;
  private final ConcurrentMap<String, Counter> counters = new ConcurrentHashMap<>();
  private final ConcurrentMap<String, Timer> timers = new ConcurrentHashMap<>();

  public CollaborationMetrics(MeterRegistry meterRegistry, ConnectionRegistry connectionRegistry) {
    this.meterRegistry = meterRegistry;
    Gauge.builder(METRIC_CONNECTIONS_CURRENT, connectionRegistry, ConnectionRegistry::connectionCount)
        .description("Currently registered live connections")
        .register(meterRegistry);
  }

  /** result is one of delivered, failed, unreachable. */
  public void recordDelivery(String result, int count) {
    if (count <= 0) {
      return;
    }
    counter(METRIC_DELIVERY_TOTAL, "Live event fan-out results per connection", Tags.of("result", result))
        .increment(count);
  }

  public void recordNotificationsCreated(String type, int count) {
    counter(METRIC_NOTIFICATION_CREATED, "Persisted notifications", Tags.of("type", type))
        .increment(count);
  }

  public void recordDigestUsers(String job, String result, int count) {
    if (count <= 0) {
      return;
    }
    counter(METRIC_DIGEST_USERS, "Digest per-user results", Tags.of("job", job, "result", result))
        .increment(count);
  }

  public void recordDigestRun(String job, Duration elapsed) {
    timers
        .computeIfAbsent(
            job,
            ignored ->
                Timer.builder(METRIC_DIGEST_RUN)
                    .description("Wall time of one digest job firing")
                    .tags(Tags.of("job", job))
                    .register(meterRegistry))
        .record(elapsed);
  }

  private Counter counter(String name, String description, Tags tags) {
    return counters.computeIfAbsent(
        name + tags,
        ignored -> Counter.builder(name).description(description).tags(tags).register(meterRegistry));
  }
}
