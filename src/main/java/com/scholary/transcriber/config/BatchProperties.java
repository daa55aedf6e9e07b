package com.scholary.transcriber.config;

import com.scholary.transcriber.batch.BatchConfig;
import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.Positive;
import jakarta.validation.constraints.PositiveOrZero;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * Default batch executor settings.
 *
 * <p>These map to the "batch.*" keys in application.yml. Presets derive from these values and only
 * change sizing.
 */
@ConfigurationProperties(prefix = "batch")
@Validated
public record BatchProperties(
    @Min(1) @Max(1000) int batchSize,
    @Min(0) @Max(10) int maxRetries,
    @PositiveOrZero long retryDelayMs,
    @PositiveOrZero long maxRetryDelayMs,
    @Min(1) @Max(10) int maxConcurrentBatches,
    @DecimalMin("1") @DecimalMax("100") double memoryThresholdPercent,
    @DecimalMin("0") @DecimalMax("1") double samplingRate,
    @Positive int maxHistorySize) {

  public BatchConfig toConfig() {
    return new BatchConfig(
        batchSize,
        maxRetries,
        retryDelayMs,
        maxRetryDelayMs,
        maxConcurrentBatches,
        memoryThresholdPercent,
        samplingRate,
        maxHistorySize,
        true);
  }
}
