package com.scholary.transcriber.job;

import java.util.concurrent.CancellationException;

/**
 * Pause and cancel gate shared between the scheduler and one run of a task.
 *
 * <p>The runner calls {@link #checkpoint()} before dispatching each unit of work. While the task is
 * paused the call blocks; once the task is cancelled it throws. Work already handed to the provider
 * is not aborted, its result is simply discarded by the scheduler.
 */
public class TaskControl {

  private final ProgressSink progressSink;
  private boolean paused;
  private volatile boolean cancelled;

  public TaskControl(ProgressSink progressSink) {
    this.progressSink = progressSink;
  }

  /**
   * Wait while paused.
   *
   * @throws CancellationException if the task was cancelled
   * @throws InterruptedException if the waiting thread is interrupted
   */
  public synchronized void checkpoint() throws InterruptedException {
    while (paused && !cancelled) {
      wait();
    }
    if (cancelled) {
      throw new CancellationException("Task cancelled");
    }
  }

  public boolean isCancelled() {
    return cancelled;
  }

  public synchronized boolean isPaused() {
    return paused;
  }

  /** Forward progress of this run; ignored after cancellation. */
  public void reportProgress(int percent, String message) {
    if (!cancelled) {
      progressSink.report(percent, message);
    }
  }

  synchronized void pause() {
    paused = true;
  }

  synchronized void resume() {
    paused = false;
    notifyAll();
  }

  synchronized void cancel() {
    cancelled = true;
    notifyAll();
  }

  /** Receives progress of one run. */
  @FunctionalInterface
  public interface ProgressSink {
    void report(int percent, String message);
  }
}
