package com.scholary.transcriber.batch;

import java.util.ArrayList;
import java.util.List;

/**
 * Tuning knobs for a {@link BatchExecutor}.
 *
 * <p>{@link #validate()} reports every violation at once so a misconfiguration is fixed in one
 * round trip.
 *
 * @param batchSize items per batch, 1..1000
 * @param maxRetries retries per batch after the first attempt, 0..10
 * @param retryDelayMs base delay before the first retry
 * @param maxRetryDelayMs cap on the exponential delay
 * @param maxConcurrentBatches batches running at once, 1..10
 * @param memoryThresholdPercent heap usage above which attempts fail fast, 1..100
 * @param samplingRate probability that a run is recorded in the history, 0..1
 * @param maxHistorySize number of run summaries kept
 * @param progressTracking whether progress events are published
 */
public record BatchConfig(
    int batchSize,
    int maxRetries,
    long retryDelayMs,
    long maxRetryDelayMs,
    int maxConcurrentBatches,
    double memoryThresholdPercent,
    double samplingRate,
    int maxHistorySize,
    boolean progressTracking) {

  public static BatchConfig defaults() {
    return new BatchConfig(100, 3, 1000, 30_000, 3, 80, 1.0, 100, true);
  }

  /** Database writes: small batches, one at a time. */
  public BatchConfig forDatabase() {
    return withSizing(50, 1);
  }

  /** Size batches and concurrency to the number of items to process. */
  public BatchConfig forItemCount(int itemCount) {
    if (itemCount > 10_000) {
      return withSizing(200, 2);
    }
    if (itemCount > 1_000) {
      return withSizing(100, 3);
    }
    return withSizing(50, 4);
  }

  public BatchConfig withSizing(int newBatchSize, int newMaxConcurrentBatches) {
    return new BatchConfig(
        newBatchSize,
        maxRetries,
        retryDelayMs,
        maxRetryDelayMs,
        newMaxConcurrentBatches,
        memoryThresholdPercent,
        samplingRate,
        maxHistorySize,
        progressTracking);
  }

  public BatchConfig withRetries(int newMaxRetries, long newRetryDelayMs) {
    return new BatchConfig(
        batchSize,
        newMaxRetries,
        newRetryDelayMs,
        Math.max(maxRetryDelayMs, newRetryDelayMs),
        maxConcurrentBatches,
        memoryThresholdPercent,
        samplingRate,
        maxHistorySize,
        progressTracking);
  }

  /**
   * Check every bound.
   *
   * @return one message per violation, empty when the config is usable
   */
  public List<String> validate() {
    List<String> errors = new ArrayList<>();
    if (batchSize < 1 || batchSize > 1000) {
      errors.add("batchSize must be between 1 and 1000, was " + batchSize);
    }
    if (maxRetries < 0 || maxRetries > 10) {
      errors.add("maxRetries must be between 0 and 10, was " + maxRetries);
    }
    if (retryDelayMs < 0) {
      errors.add("retryDelayMs must not be negative, was " + retryDelayMs);
    }
    if (maxRetryDelayMs < retryDelayMs) {
      errors.add(
          "maxRetryDelayMs must be at least retryDelayMs (" + retryDelayMs + "), was " + maxRetryDelayMs);
    }
    if (maxConcurrentBatches < 1 || maxConcurrentBatches > 10) {
      errors.add("maxConcurrentBatches must be between 1 and 10, was " + maxConcurrentBatches);
    }
    if (memoryThresholdPercent < 1 || memoryThresholdPercent > 100) {
      errors.add("memoryThresholdPercent must be between 1 and 100, was " + memoryThresholdPercent);
    }
    if (samplingRate < 0 || samplingRate > 1) {
      errors.add("samplingRate must be between 0 and 1, was " + samplingRate);
    }
    if (maxHistorySize < 1 || maxHistorySize > 10_000) {
      errors.add("maxHistorySize must be between 1 and 10000, was " + maxHistorySize);
    }
    return errors;
  }
}
