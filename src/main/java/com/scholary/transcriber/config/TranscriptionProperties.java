package com.scholary.transcriber.config;

import jakarta.validation.Valid;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Positive;
import jakarta.validation.constraints.PositiveOrZero;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * Configuration properties for transcription processing.
 *
 * <p>Controls chunking, pre-upload optimization, result caching and the client-side retry policy.
 */
@ConfigurationProperties(prefix = "transcription")
@Validated
public record TranscriptionProperties(
    @Valid ChunkingProperties chunking,
    @Valid OptimizationProperties optimization,
    @Valid CacheProperties cache,
    @Valid RetryProperties retry) {

  public record ChunkingProperties(
      @Positive double chunkSeconds,
      @PositiveOrZero double overlapSeconds,
      @Positive int maxChunks,
      @Positive long maxFileSizeBytes,
      @Positive double chunkThresholdSeconds) {}

  public record OptimizationProperties(
      @Positive long optimalSizeBytes,
      @Positive long maxUploadBytes,
      @Positive int maxDurationSeconds) {}

  public record CacheProperties(
      @Positive int maxSize, @Positive int ttlMinutes, @Positive int sweepIntervalSeconds) {}

  public record RetryProperties(
      @Positive int maxAttempts,
      @PositiveOrZero long baseDelayMs,
      @DecimalMin("1.0") double multiplier,
      @PositiveOrZero long maxDelayMs) {}
}
