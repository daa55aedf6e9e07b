package com.scholary.transcriber.provider;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Positive;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * Configuration properties for the speech-to-text provider.
 *
 * <p>These control where requests go, which credential is sent and how long a call may take. The
 * request timeout is the overall budget of one call, upload included.
 */
@ConfigurationProperties(prefix = "provider")
@Validated
public record ProviderProperties(
    @NotBlank String baseUrl,
    @NotBlank String apiKey,
    @NotBlank String defaultModel,
    @Positive int connectTimeoutSeconds,
    @Positive int requestTimeoutSeconds) {}
