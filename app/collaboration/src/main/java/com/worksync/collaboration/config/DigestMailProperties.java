package com.worksync.collaboration.config;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Pattern;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * Outbound e-mail settings. {@code transport=log} writes rendered mails to the log instead of
 * talking to SMTP; the SMTP server itself is configured under {@code spring.mail}.
 */
@ConfigurationProperties(prefix = "collaboration.mail")
@Validated
public record DigestMailProperties(
    @NotBlank @Pattern(regexp = "log|smtp") String transport,
    @NotBlank String fromAddress,
    @NotBlank String appUrl) {}
