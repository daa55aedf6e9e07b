package com.scholary.transcriber.transcription;

import com.scholary.transcriber.config.TranscriptionProperties.RetryProperties;

/**
 * Retry policy for {@link TranscriptionClient#executeWithRetry}.
 *
 * <p>The delay after failed attempt {@code n} (zero-based) is {@code min(baseDelayMs *
 * multiplier^n, maxDelayMs)}, stretched to the provider's suggestion when it asked for longer.
 *
 * @param maxAttempts total attempts, including the first
 */
public record RetryPolicy(int maxAttempts, long baseDelayMs, double multiplier, long maxDelayMs) {

  public RetryPolicy {
    if (maxAttempts < 1) {
      throw new IllegalArgumentException("maxAttempts must be at least 1: " + maxAttempts);
    }
  }

  public static RetryPolicy from(RetryProperties properties) {
    return new RetryPolicy(
        properties.maxAttempts(),
        properties.baseDelayMs(),
        properties.multiplier(),
        properties.maxDelayMs());
  }

  public long delayFor(int attempt) {
    return (long) Math.min(baseDelayMs * Math.pow(multiplier, attempt), maxDelayMs);
  }
}
