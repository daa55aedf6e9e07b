package com.scholary.transcriber.job;

import java.time.Instant;

/**
 * Immutable snapshot of a task, safe to hand out of the scheduler.
 *
 * @param progress 0..100, non-decreasing within one run
 * @param error diagnostic message of the last failure
 * @param errorHint what the user can do about the failure
 * @param attempt 1 for the first run, incremented by every retry
 */
public record TaskView(
    String id,
    String fileId,
    TaskStatus status,
    int progress,
    TaskMetadata metadata,
    TaskOptions options,
    TaskPriority priority,
    String message,
    String error,
    String errorHint,
    TaskResult result,
    int attempt,
    Instant createdAt,
    Instant startedAt,
    Instant completedAt) {}
