/*
 * Where: collaboration service configuration
 * What: WebSocket endpoint, origin list, per-connection send limits and room revalidation cadence
 * Why: slow clients and revoked access are tuned per environment
 */
package com.worksync.collaboration.config;

import jakarta.validation.constraints.AssertTrue;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotEmpty;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import java.time.Duration;
import java.util.List;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

@ConfigurationProperties(prefix = "collaboration.realtime")
@Validated
public record RealtimeProperties(
    @NotBlank String endpoint,
    @NotEmpty List<String> allowedOrigins,
    @NotNull Duration sendTimeLimit,
    @Positive int sendBufferSizeLimit,
    boolean revalidationEnabled,
    @NotNull Duration revalidationInterval) {

  public RealtimeProperties {
    allowedOrigins = allowedOrigins == null ? List.of() : List.copyOf(allowedOrigins);
  }

  @AssertTrue(message = "collaboration.realtime.send-time-limit must be positive")
  public boolean isSendTimeLimitPositive() {
    return isPositive(sendTimeLimit);
  }

  @AssertTrue(message = "collaboration.realtime.revalidation-interval must be positive")
  public boolean isRevalidationIntervalPositive() {
    return isPositive(revalidationInterval);
  }

  private static boolean isPositive(Duration duration) {
    // null is reported by @NotNull
    return duration == null || (!duration.isZero() && !duration.isNegative());
  }
}
