package com.scholary.transcriber.job;

import java.time.Instant;

/**
 * Mutable state of a transcription task.
 *
 * <p>Not thread-safe: every read and write happens under the scheduler's lock. Callers outside the
 * scheduler only ever see {@link TaskView} snapshots.
 */
class TranscriptionTask {

  private final String id;
  private final String fileId;
  private final TaskMetadata metadata;
  private final TaskOptions options;
  private final Instant createdAt;

  private TaskStatus status = TaskStatus.IDLE;
  private int progress;
  private String message;
  private String error;
  private String errorHint;
  private TaskResult result;
  private int attempt = 1;
  private long sequence;
  private Instant startedAt;
  private Instant completedAt;

  TranscriptionTask(String id, String fileId, TaskMetadata metadata, TaskOptions options) {
    this.id = id;
    this.fileId = fileId;
    this.metadata = metadata;
    this.options = options;
    this.createdAt = Instant.now();
  }

  String getId() {
    return id;
  }

  String getFileId() {
    return fileId;
  }

  TaskPriority getPriority() {
    return options.priority();
  }

  TaskStatus getStatus() {
    return status;
  }

  void setStatus(TaskStatus status) {
    this.status = status;
  }

  int getProgress() {
    return progress;
  }

  void setProgress(int progress) {
    this.progress = progress;
  }

  void setMessage(String message) {
    this.message = message;
  }

  String getMessage() {
    return message;
  }

  void setError(String error, String errorHint) {
    this.error = error;
    this.errorHint = errorHint;
  }

  void setResult(TaskResult result) {
    this.result = result;
  }

  int getAttempt() {
    return attempt;
  }

  void incrementAttempt() {
    attempt++;
  }

  long getSequence() {
    return sequence;
  }

  void setSequence(long sequence) {
    this.sequence = sequence;
  }

  void setStartedAt(Instant startedAt) {
    this.startedAt = startedAt;
  }

  void setCompletedAt(Instant completedAt) {
    this.completedAt = completedAt;
  }

  TaskView toView() {
    return new TaskView(
        id,
        fileId,
        status,
        progress,
        metadata,
        options,
        options.priority(),
        message,
        error,
        errorHint,
        result,
        attempt,
        createdAt,
        startedAt,
        completedAt);
  }
}
