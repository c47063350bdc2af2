package com.worksync.collaboration.config;

import jakarta.validation.Valid;
import jakarta.validation.constraints.AssertTrue;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import java.nio.charset.StandardCharsets;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * Bearer token verification settings.
 *
 * <p>{@code devToken} maps a fixed credential to a seeded user for local development. It is only
 * honored when a {@code dev} or {@code local} profile is active.
 */
@ConfigurationProperties(prefix = "collaboration.identity")
@Validated
public record IdentityProperties(
    @NotBlank String jwtSecret, String issuer, @NotNull @Valid DevToken devToken) {

  /** HS256 needs at least 256 bits of key material. */
  static final int MIN_SECRET_BYTES = 32;

  public record DevToken(boolean enabled, String value, String userEmail) {

    @AssertTrue(message = "collaboration.identity.dev-token requires value and user-email when enabled")
    public boolean isCompleteWhenEnabled() {
      if (!enabled) {
        return true;
      }
      return value != null && !value.isBlank() && userEmail != null && !userEmail.isBlank();
    }
  }

  @AssertTrue(message = "collaboration.identity.jwt-secret must be at least 32 bytes")
  public boolean isJwtSecretLongEnough() {
    return jwtSecret == null || jwtSecret.getBytes(StandardCharsets.UTF_8).length >= MIN_SECRET_BYTES;
  }

  public boolean hasIssuer() {
    return issuer != null && !issuer.isBlank();
  }
}
