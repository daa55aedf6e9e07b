package com.scholary.transcriber.job;

import java.time.Instant;

/** A change in a task's status or progress, as delivered to event subscribers. */
public record TaskEvent(
    String taskId, String fileId, TaskStatus status, int progress, String message, Instant timestamp) {}
