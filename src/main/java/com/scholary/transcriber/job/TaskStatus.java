package com.scholary.transcriber.job;

import java.util.EnumSet;
import java.util.Set;

/**
 * Lifecycle of a transcription task.
 *
 * <pre>
 * IDLE -> QUEUED -> PROCESSING -> COMPLETED | FAILED | CANCELLED
 *                   PROCESSING <-> PAUSED
 *                   FAILED -> QUEUED (retry)
 *                   QUEUED | PAUSED -> CANCELLED
 * </pre>
 *
 * <p>COMPLETED and CANCELLED are terminal. FAILED only leaves through an explicit retry.
 */
public enum TaskStatus {
  IDLE,
  QUEUED,
  PROCESSING,
  PAUSED,
  COMPLETED,
  FAILED,
  CANCELLED;

  private Set<TaskStatus> successors;

  static {
    IDLE.successors = EnumSet.of(QUEUED);
    QUEUED.successors = EnumSet.of(PROCESSING, CANCELLED);
    PROCESSING.successors = EnumSet.of(COMPLETED, FAILED, CANCELLED, PAUSED);
    PAUSED.successors = EnumSet.of(PROCESSING, CANCELLED);
    FAILED.successors = EnumSet.of(QUEUED);
    COMPLETED.successors = EnumSet.noneOf(TaskStatus.class);
    CANCELLED.successors = EnumSet.noneOf(TaskStatus.class);
  }

  public boolean canTransitionTo(TaskStatus next) {
    return successors.contains(next);
  }

  /** Queued, processing or paused: the task still holds its file. */
  public boolean isActive() {
    return this == QUEUED || this == PROCESSING || this == PAUSED;
  }

  public boolean isTerminal() {
    return this == COMPLETED || this == CANCELLED;
  }
}
