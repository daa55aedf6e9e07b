package com.scholary.transcriber.job;

/**
 * Does the work of one task run on a scheduler worker thread.
 *
 * <p>Implementations call {@link TaskControl#checkpoint()} between units of work so that pause and
 * cancel take effect, and report progress through the control.
 */
@FunctionalInterface
public interface TaskRunner {

  /**
   * Process the task.
   *
   * @param task snapshot of the task at dispatch
   * @param control pause/cancel gate and progress sink for this run
   * @return the outcome of a successful run
   * @throws java.util.concurrent.CancellationException when the run noticed a cancellation
   * @throws Exception any failure; the task fails with it
   */
  TaskResult run(TaskView task, TaskControl control) throws Exception;
}
