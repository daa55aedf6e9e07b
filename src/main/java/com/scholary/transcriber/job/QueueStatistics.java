package com.scholary.transcriber.job;

import java.util.Map;

/**
 * Snapshot of the scheduler.
 *
 * @param countsByStatus known tasks per status, including archived finished tasks
 * @param successRate completed / (completed + failed), 0 when nothing finished yet
 * @param queueLength tasks waiting for a worker slot
 * @param runningTasks tasks holding a worker slot
 * @param maxConcurrency worker slots
 * @param estimatedWaitSeconds wait for a task added now
 */
public record QueueStatistics(
    Map<TaskStatus, Long> countsByStatus,
    double successRate,
    int queueLength,
    int runningTasks,
    int maxConcurrency,
    long estimatedWaitSeconds) {

  public QueueStatistics {
    countsByStatus = Map.copyOf(countsByStatus);
  }
}
