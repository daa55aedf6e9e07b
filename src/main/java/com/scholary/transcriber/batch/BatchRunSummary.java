package com.scholary.transcriber.batch;

import java.time.Instant;

/** Entry in the sampled run history of a {@link BatchExecutor}. */
public record BatchRunSummary(
    Instant startedAt, long durationMs, int totalItems, int totalBatches, boolean success, int retryCount) {}
