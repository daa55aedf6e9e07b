package com.scholary.transcriber.batch;

/**
 * Timing of one run.
 *
 * @param durationMs wall-clock time of the whole run
 * @param retryCount retry attempts actually made across all batches
 * @param averageBatchTimeMs mean time spent per batch, including retries
 */
public record BatchPerformance(long durationMs, int retryCount, long averageBatchTimeMs) {}
