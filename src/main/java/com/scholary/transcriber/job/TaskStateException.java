package com.scholary.transcriber.job;

/** An operation that the task's current state does not allow. */
public class TaskStateException extends RuntimeException {

  private final String taskId;
  private final TaskStatus status;

  public TaskStateException(String taskId, TaskStatus status, String message) {
    super(message);
    this.taskId = taskId;
    this.status = status;
  }

  public String getTaskId() {
    return taskId;
  }

  public TaskStatus getStatus() {
    return status;
  }
}
