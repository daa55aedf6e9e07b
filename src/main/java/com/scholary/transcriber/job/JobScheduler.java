package com.scholary.transcriber.job;

import com.scholary.transcriber.config.SchedulerProperties;
import com.scholary.transcriber.error.TranscriberException;
import com.scholary.transcriber.event.ProgressFeed;
import com.scholary.transcriber.logging.StructuredLogger;
import com.scholary.transcriber.provider.ErrorClassifier;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.PriorityQueue;
import java.util.UUID;
import java.util.concurrent.CancellationException;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.DisposableBean;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

/**
 * Per-file task scheduler.
 *
 * <p>Each file has at most one active task. Tasks wait in a queue ordered by priority tier and, within
 * a tier, by arrival; a task is dispatched to the worker pool as soon as one of the
 * {@code maxConcurrency} slots is free. Every status change goes through {@link TaskStatus} and is
 * published on {@link #events()}.
 *
 * <p>Cancellation is cooperative. Cancelling a running task releases its slot at once and marks the
 * run as abandoned; whatever that run produces afterwards, result or failure, is discarded.
 *
 * <p>All task state is guarded by one lock. Events are published while holding it, so subscribers
 * see them in order and must return quickly.
 */
@Service
public class JobScheduler implements DisposableBean {

  private static final Logger LOGGER = LoggerFactory.getLogger(JobScheduler.class);
  private static final StructuredLogger STRUCTURED_LOGGER = new StructuredLogger(LOGGER);

  private static final Comparator<TranscriptionTask> QUEUE_ORDER =
      Comparator.comparing(TranscriptionTask::getPriority)
          .thenComparingLong(TranscriptionTask::getSequence);

  private final Object lock = new Object();
  private final TaskRepository repository;
  private final TaskRunner runner;
  private final Executor executor;
  private final int maxConcurrency;
  private final long averageTaskSeconds;

  private final PriorityQueue<TranscriptionTask> queue = new PriorityQueue<>(QUEUE_ORDER);
  private final Map<String, TaskControl> running = new HashMap<>();
  private final ProgressFeed<TaskEvent> events = new ProgressFeed<>();
  private long nextSequence;
  private boolean shutDown;

  @Autowired
  JobScheduler(
      TaskRepository repository,
      TaskRunner runner,
      @Qualifier("transcriptionExecutor") Executor executor,
      SchedulerProperties properties) {
    this(repository, runner, executor, properties.maxConcurrency(), properties.averageTaskSeconds());
  }

  JobScheduler(
      TaskRepository repository,
      TaskRunner runner,
      Executor executor,
      int maxConcurrency,
      long averageTaskSeconds) {
    if (maxConcurrency <= 0) {
      throw new IllegalArgumentException("maxConcurrency must be positive: " + maxConcurrency);
    }
    this.repository = repository;
    this.runner = runner;
    this.executor = executor;
    this.maxConcurrency = maxConcurrency;
    this.averageTaskSeconds = averageTaskSeconds;
  }

  /** Task status and progress changes. */
  public ProgressFeed<TaskEvent> events() {
    return events;
  }

  /**
   * Queue a file for transcription.
   *
   * @return the queued task, or the running one when a slot was free
   * @throws TaskStateException if the file already has an active task
   */
  public TaskView addTask(String fileId, TaskMetadata metadata, TaskOptions options) {
    synchronized (lock) {
      if (shutDown) {
        throw new IllegalStateException("Scheduler is shut down");
      }
      Optional<TranscriptionTask> existing = repository.findActiveByFile(fileId);
      if (existing.isPresent()) {
        TranscriptionTask task = existing.get();
        throw new TaskStateException(
            task.getId(),
            task.getStatus(),
            String.format(
                "File %s already has an active task %s (%s)",
                fileId, task.getId(), task.getStatus()));
      }

      TranscriptionTask task =
          new TranscriptionTask(
              UUID.randomUUID().toString(),
              fileId,
              metadata,
              options != null ? options : TaskOptions.defaults());
      repository.save(task);
      enqueue(task, "Queued");
      dispatch();
      return task.toView();
    }
  }

  /**
   * Cancel a queued, running or paused task.
   *
   * @throws TaskNotFoundException if the task is unknown
   * @throws TaskStateException if the task already finished
   */
  public TaskView cancelTask(String taskId) {
    synchronized (lock) {
      TranscriptionTask task = require(taskId);
      requireTransition(task, TaskStatus.CANCELLED, "cancel");
      cancel(task, "Cancelled");
      dispatch();
      return task.toView();
    }
  }

  /**
   * Stop dispatching new chunk work for a running task. Chunks already sent to the provider finish
   * and their results are kept. The task keeps its worker slot.
   */
  public TaskView pauseTask(String taskId) {
    synchronized (lock) {
      TranscriptionTask task = require(taskId);
      requireStatus(task, TaskStatus.PROCESSING, "pause");
      running.get(taskId).pause();
      transition(task, TaskStatus.PAUSED, "Paused");
      return task.toView();
    }
  }

  public TaskView resumeTask(String taskId) {
    synchronized (lock) {
      TranscriptionTask task = require(taskId);
      requireStatus(task, TaskStatus.PAUSED, "resume");
      running.get(taskId).resume();
      transition(task, TaskStatus.PROCESSING, "Resumed");
      return task.toView();
    }
  }

  /**
   * Queue a failed task again with the same metadata and options.
   *
   * @throws TaskStateException if the task did not fail, or its file got another active task
   */
  public TaskView retryTask(String taskId) {
    synchronized (lock) {
      TranscriptionTask task = require(taskId);
      requireStatus(task, TaskStatus.FAILED, "retry");
      Optional<TranscriptionTask> other = repository.findActiveByFile(task.getFileId());
      if (other.isPresent()) {
        throw new TaskStateException(
            taskId,
            task.getStatus(),
            String.format(
                "File %s already has an active task %s", task.getFileId(), other.get().getId()));
      }

      task.incrementAttempt();
      task.setProgress(0);
      task.setError(null, null);
      task.setResult(null);
      task.setStartedAt(null);
      task.setCompletedAt(null);
      repository.save(task);
      enqueue(task, "Retry " + task.getAttempt());
      dispatch();
      return task.toView();
    }
  }

  /** The most recent task of a file. */
  public Optional<TaskView> getTask(String fileId) {
    synchronized (lock) {
      return repository.findLatestByFile(fileId).map(TranscriptionTask::toView);
    }
  }

  public Optional<TaskView> getTaskById(String taskId) {
    synchronized (lock) {
      return repository.findById(taskId).map(TranscriptionTask::toView);
    }
  }

  /** Queued tasks in dispatch order. */
  public List<TaskView> listQueue() {
    synchronized (lock) {
      return orderedQueue().stream().map(TranscriptionTask::toView).toList();
    }
  }

  /**
   * Position of a queued task.
   *
   * @return empty when the task is not waiting in the queue
   * @throws TaskNotFoundException if the task is unknown
   */
  public Optional<QueuePosition> getQueuePosition(String taskId) {
    synchronized (lock) {
      require(taskId);
      List<TranscriptionTask> ordered = orderedQueue();
      for (int i = 0; i < ordered.size(); i++) {
        if (ordered.get(i).getId().equals(taskId)) {
          return Optional.of(new QueuePosition(i, i, estimatedWaitSeconds(i)));
        }
      }
      return Optional.empty();
    }
  }

  public QueueStatistics getStatistics() {
    synchronized (lock) {
      Map<TaskStatus, Long> counts = new EnumMap<>(TaskStatus.class);
      for (TranscriptionTask task : repository.findAll()) {
        counts.merge(task.getStatus(), 1L, Long::sum);
      }
      long completed = counts.getOrDefault(TaskStatus.COMPLETED, 0L);
      long failed = counts.getOrDefault(TaskStatus.FAILED, 0L);
      double successRate = completed + failed == 0 ? 0 : (double) completed / (completed + failed);
      return new QueueStatistics(
          counts,
          successRate,
          queue.size(),
          running.size(),
          maxConcurrency,
          estimatedWaitSeconds(queue.size()));
    }
  }

  /**
   * Forget a task, cancelling it first when it is still active.
   *
   * @return false if the task is unknown
   */
  public boolean removeTask(String taskId) {
    synchronized (lock) {
      Optional<TranscriptionTask> found = repository.findById(taskId);
      if (found.isEmpty()) {
        return false;
      }
      TranscriptionTask task = found.get();
      if (task.getStatus().isActive()) {
        cancel(task, "Removed");
        dispatch();
      }
      repository.remove(task);
      return true;
    }
  }

  /**
   * Forget every completed or cancelled task.
   *
   * @return the number of tasks removed
   */
  public int clearCompleted() {
    synchronized (lock) {
      int removed = 0;
      for (TranscriptionTask task : repository.findAll()) {
        if (task.getStatus().isTerminal()) {
          repository.remove(task);
          removed++;
        }
      }
      LOGGER.info("Cleared {} finished tasks", removed);
      return removed;
    }
  }

  /** Cancel all queued and running work and refuse new tasks. */
  public void shutdown() {
    synchronized (lock) {
      if (shutDown) {
        return;
      }
      shutDown = true;
      List<TranscriptionTask> active = new ArrayList<>(queue);
      for (String taskId : running.keySet()) {
        repository.findById(taskId).ifPresent(active::add);
      }
      for (TranscriptionTask task : active) {
        cancel(task, "Scheduler shut down");
      }
      LOGGER.info("Scheduler shut down, cancelled {} tasks", active.size());
    }
  }

  @Override
  public void destroy() {
    shutdown();
  }

  private void enqueue(TranscriptionTask task, String message) {
    task.setSequence(nextSequence++);
    transition(task, TaskStatus.QUEUED, message);
    queue.add(task);
  }

  /** Fill free worker slots from the head of the queue. Caller holds the lock. */
  private void dispatch() {
    while (!shutDown && running.size() < maxConcurrency && !queue.isEmpty()) {
      TranscriptionTask task = queue.poll();
      String taskId = task.getId();
      TaskControl control =
          new TaskControl((percent, message) -> onProgress(taskId, percent, message));
      running.put(taskId, control);
      task.setStartedAt(Instant.now());
      transition(task, TaskStatus.PROCESSING, "Started");

      TaskView snapshot = task.toView();
      try {
        executor.execute(() -> execute(snapshot, control));
      } catch (RejectedExecutionException e) {
        LOGGER.error("Worker pool rejected task {}", taskId, e);
        running.remove(taskId);
        fail(task, "Worker pool rejected the task: " + e.getMessage(), "Retry later");
      }
    }
  }

  private void execute(TaskView task, TaskControl control) {
    StructuredLogger.setTaskContext(task.id(), task.fileId());
    try {
      TaskResult result = runner.run(task, control);
      onSuccess(task.id(), control, result);
    } catch (CancellationException e) {
      onCancelledByRunner(task.id(), control);
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      onCancelledByRunner(task.id(), control);
    } catch (Exception e) {
      onFailure(task.id(), control, e);
    } catch (Error e) {
      // Free the slot before the error reaches the worker thread
      onFailure(task.id(), control, e);
      throw e;
    } finally {
      StructuredLogger.clearTaskContext();
    }
  }

  private void onProgress(String taskId, int percent, String message) {
    synchronized (lock) {
      if (running.get(taskId) == null) {
        return;
      }
      TranscriptionTask task = repository.findById(taskId).orElse(null);
      if (task == null) {
        return;
      }
      // 100 is reserved for completion
      int next = Math.max(task.getProgress(), Math.min(Math.max(percent, 0), 99));
      if (next == task.getProgress() && message == null) {
        return;
      }
      task.setProgress(next);
      if (message != null) {
        task.setMessage(message);
      }
      publish(task);
    }
  }

  private void onSuccess(String taskId, TaskControl control, TaskResult result) {
    synchronized (lock) {
      if (!ownsSlot(taskId, control)) {
        LOGGER.info("Discarding result of abandoned run of task {}", taskId);
        return;
      }
      running.remove(taskId);
      TranscriptionTask task = repository.findById(taskId).orElseThrow();
      if (task.getStatus() == TaskStatus.PAUSED) {
        transition(task, TaskStatus.PROCESSING, "Resumed to finish");
      }
      task.setResult(result);
      task.setProgress(100);
      task.setCompletedAt(Instant.now());
      String message =
          result.partial()
              ? String.format("Completed with %d failed chunks", result.failedChunks())
              : "Completed";
      transition(task, TaskStatus.COMPLETED, message);
      repository.archive(task);
      dispatch();
    }
  }

  private void onFailure(String taskId, TaskControl control, Throwable error) {
    synchronized (lock) {
      if (!ownsSlot(taskId, control)) {
        LOGGER.info(
            "Discarding failure of abandoned run of task {}: {}", taskId, error.getMessage());
        return;
      }
      running.remove(taskId);
      TranscriptionTask task = repository.findById(taskId).orElseThrow();
      if (task.getStatus() == TaskStatus.PAUSED) {
        transition(task, TaskStatus.PROCESSING, "Resumed to fail");
      }
      TranscriberException classified = ErrorClassifier.classify(error);
      LOGGER.error(
          "Task {} failed: kind={}, message={}", taskId, classified.getKind(), error.getMessage());
      fail(
          task,
          Objects.toString(error.getMessage(), error.getClass().getSimpleName()),
          classified.getHint());
      dispatch();
    }
  }

  private void onCancelledByRunner(String taskId, TaskControl control) {
    synchronized (lock) {
      if (!ownsSlot(taskId, control)) {
        return;
      }
      // The runner gave up without a cancel request, e.g. its thread was interrupted
      running.remove(taskId);
      TranscriptionTask task = repository.findById(taskId).orElseThrow();
      task.setCompletedAt(Instant.now());
      transition(task, TaskStatus.CANCELLED, "Interrupted");
      repository.archive(task);
      dispatch();
    }
  }

  private void cancel(TranscriptionTask task, String message) {
    if (task.getStatus() == TaskStatus.QUEUED) {
      queue.remove(task);
    } else {
      TaskControl control = running.remove(task.getId());
      if (control != null) {
        control.cancel();
      }
    }
    task.setCompletedAt(Instant.now());
    transition(task, TaskStatus.CANCELLED, message);
    repository.archive(task);
  }

  /** Failed tasks stay in the active set, not the archive, so a retry always finds them. */
  private void fail(TranscriptionTask task, String error, String hint) {
    task.setError(error, hint);
    task.setCompletedAt(Instant.now());
    transition(task, TaskStatus.FAILED, "Failed");
  }

  private void transition(TranscriptionTask task, TaskStatus next, String message) {
    TaskStatus current = task.getStatus();
    if (!current.canTransitionTo(next)) {
      throw new TaskStateException(
          task.getId(), current, String.format("Illegal transition %s -> %s", current, next));
    }
    task.setStatus(next);
    task.setMessage(message);
    STRUCTURED_LOGGER.logTaskTransition(task.getId(), task.getFileId(), current.name(), next.name());
    publish(task);
  }

  private void publish(TranscriptionTask task) {
    events.publish(
        new TaskEvent(
            task.getId(),
            task.getFileId(),
            task.getStatus(),
            task.getProgress(),
            task.getMessage(),
            Instant.now()));
  }

  private boolean ownsSlot(String taskId, TaskControl control) {
    return running.get(taskId) == control;
  }

  private TranscriptionTask require(String taskId) {
    return repository
        .findById(taskId)
        .orElseThrow(() -> new TaskNotFoundException("Task not found: " + taskId));
  }

  private static void requireStatus(TranscriptionTask task, TaskStatus expected, String operation) {
    if (task.getStatus() != expected) {
      throw new TaskStateException(
          task.getId(),
          task.getStatus(),
          String.format(
              "Cannot %s task %s in status %s, expected %s",
              operation, task.getId(), task.getStatus(), expected));
    }
  }

  private static void requireTransition(TranscriptionTask task, TaskStatus next, String operation) {
    if (!task.getStatus().canTransitionTo(next)) {
      throw new TaskStateException(
          task.getId(),
          task.getStatus(),
          String.format("Cannot %s task %s in status %s", operation, task.getId(), task.getStatus()));
    }
  }

  private List<TranscriptionTask> orderedQueue() {
    List<TranscriptionTask> ordered = new ArrayList<>(queue);
    ordered.sort(QUEUE_ORDER);
    return ordered;
  }

  private long estimatedWaitSeconds(int tasksAhead) {
    return (long) Math.ceil((double) tasksAhead / maxConcurrency) * averageTaskSeconds;
  }
}
