package com.scholary.transcriber.job;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.awaitility.Awaitility.await;

import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class JobSchedulerTest {

  private static final TaskMetadata METADATA =
      new TaskMetadata("talk.wav", 1024, 30.0, "wav", null);

  private final ScriptedRunner runner = new ScriptedRunner();
  private ExecutorService pool;
  private JobScheduler scheduler;
  private final List<TaskEvent> events = new CopyOnWriteArrayList<>();

  @BeforeEach
  void setUp() {
    pool = Executors.newCachedThreadPool();
    scheduler =
        new JobScheduler(new TaskRepository(100, Duration.ofMinutes(5)), runner, pool, 1, 60);
    scheduler.events().subscribe(events::add);
  }

  @AfterEach
  void tearDown() throws InterruptedException {
    runner.releaseAll();
    scheduler.shutdown();
    pool.shutdownNow();
    pool.awaitTermination(5, TimeUnit.SECONDS);
  }

  @Test
  void addTask_shouldStartImmediatelyWhenSlotIsFree() {
    TaskView task = scheduler.addTask("file-1", METADATA, TaskOptions.defaults());

    assertThat(task.status()).isEqualTo(TaskStatus.PROCESSING);
    runner.awaitStarted("file-1");
    runner.complete("file-1", result(false));

    awaitStatus(task.id(), TaskStatus.COMPLETED);
    TaskView done = scheduler.getTaskById(task.id()).orElseThrow();
    assertThat(done.progress()).isEqualTo(100);
    assertThat(done.result().transcriptId()).isEqualTo("transcript-1");
    assertThat(done.completedAt()).isNotNull();
  }

  @Test
  void addTask_shouldRejectSecondActiveTaskForSameFile() {
    scheduler.addTask("file-1", METADATA, TaskOptions.defaults());

    assertThatThrownBy(() -> scheduler.addTask("file-1", METADATA, TaskOptions.defaults()))
        .isInstanceOf(TaskStateException.class)
        .hasMessageContaining("already has an active task");
  }

  @Test
  void addTask_shouldQueueByPriorityThenArrival() {
    scheduler.addTask("busy", METADATA, TaskOptions.defaults());
    TaskView low = scheduler.addTask("low", METADATA, withPriority(TaskPriority.LOW));
    TaskView normal = scheduler.addTask("normal", METADATA, TaskOptions.defaults());
    TaskView urgent = scheduler.addTask("urgent", METADATA, withPriority(TaskPriority.URGENT));
    TaskView normal2 = scheduler.addTask("normal-2", METADATA, TaskOptions.defaults());

    assertThat(scheduler.listQueue())
        .extracting(TaskView::id)
        .containsExactly(urgent.id(), normal.id(), normal2.id(), low.id());
    assertThat(low.status()).isEqualTo(TaskStatus.QUEUED);
  }

  @Test
  void getQueuePosition_shouldEstimateWaitFromTasksAhead() {
    TaskView running = scheduler.addTask("busy", METADATA, TaskOptions.defaults());
    TaskView first = scheduler.addTask("a", METADATA, TaskOptions.defaults());
    TaskView second = scheduler.addTask("b", METADATA, TaskOptions.defaults());

    assertThat(scheduler.getQueuePosition(first.id()))
        .contains(new QueuePosition(0, 0, 0));
    assertThat(scheduler.getQueuePosition(second.id()))
        .contains(new QueuePosition(1, 1, 60));
    assertThat(scheduler.getQueuePosition(running.id())).isEmpty();
    assertThatThrownBy(() -> scheduler.getQueuePosition("missing"))
        .isInstanceOf(TaskNotFoundException.class);
  }

  @Test
  void completion_shouldDispatchNextQueuedTask() {
    TaskView first = scheduler.addTask("a", METADATA, TaskOptions.defaults());
    TaskView second = scheduler.addTask("b", METADATA, TaskOptions.defaults());
    assertThat(second.status()).isEqualTo(TaskStatus.QUEUED);

    runner.awaitStarted("a");
    runner.complete("a", result(false));

    awaitStatus(first.id(), TaskStatus.COMPLETED);
    awaitStatus(second.id(), TaskStatus.PROCESSING);
    runner.awaitStarted("b");
  }

  @Test
  void cancelTask_shouldDiscardLateResultOfRunningTask() {
    TaskView task = scheduler.addTask("a", METADATA, TaskOptions.defaults());
    TaskView next = scheduler.addTask("b", METADATA, TaskOptions.defaults());
    runner.awaitStarted("a");

    TaskView cancelled = scheduler.cancelTask(task.id());
    assertThat(cancelled.status()).isEqualTo(TaskStatus.CANCELLED);
    awaitStatus(next.id(), TaskStatus.PROCESSING);

    runner.complete("a", result(false));
    runner.awaitFinished("a");

    TaskView after = scheduler.getTaskById(task.id()).orElseThrow();
    assertThat(after.status()).isEqualTo(TaskStatus.CANCELLED);
    assertThat(after.result()).isNull();
  }

  @Test
  void cancelTask_shouldRemoveQueuedTaskFromQueue() {
    scheduler.addTask("busy", METADATA, TaskOptions.defaults());
    TaskView queued = scheduler.addTask("a", METADATA, TaskOptions.defaults());

    scheduler.cancelTask(queued.id());

    assertThat(scheduler.listQueue()).isEmpty();
    assertThat(scheduler.getTask("a")).get().extracting(TaskView::status).isEqualTo(TaskStatus.CANCELLED);
  }

  @Test
  void cancelTask_shouldRejectFinishedTask() {
    TaskView task = scheduler.addTask("a", METADATA, TaskOptions.defaults());
    runner.complete("a", result(false));
    awaitStatus(task.id(), TaskStatus.COMPLETED);

    assertThatThrownBy(() -> scheduler.cancelTask(task.id()))
        .isInstanceOf(TaskStateException.class)
        .extracting(e -> ((TaskStateException) e).getStatus())
        .isEqualTo(TaskStatus.COMPLETED);
  }

  @Test
  void pauseTask_shouldBlockCheckpointUntilResumed() {
    TaskView task = scheduler.addTask("a", METADATA, TaskOptions.defaults());
    runner.awaitStarted("a");

    assertThat(scheduler.pauseTask(task.id()).status()).isEqualTo(TaskStatus.PAUSED);
    assertThat(runner.control("a").isPaused()).isTrue();

    assertThat(scheduler.resumeTask(task.id()).status()).isEqualTo(TaskStatus.PROCESSING);
    assertThat(runner.control("a").isPaused()).isFalse();
  }

  @Test
  void pauseTask_shouldRejectQueuedTask() {
    scheduler.addTask("busy", METADATA, TaskOptions.defaults());
    TaskView queued = scheduler.addTask("a", METADATA, TaskOptions.defaults());

    assertThatThrownBy(() -> scheduler.pauseTask(queued.id()))
        .isInstanceOf(TaskStateException.class);
    assertThatThrownBy(() -> scheduler.resumeTask(queued.id()))
        .isInstanceOf(TaskStateException.class);
  }

  @Test
  void failure_shouldRecordErrorWithHintAndAllowRetry() {
    TaskView task = scheduler.addTask("a", METADATA, TaskOptions.defaults());
    runner.awaitStarted("a");
    runner.fail("a", new IllegalStateException("429 rate limit"));

    awaitStatus(task.id(), TaskStatus.FAILED);
    TaskView failed = scheduler.getTaskById(task.id()).orElseThrow();
    assertThat(failed.error()).isEqualTo("429 rate limit");
    assertThat(failed.errorHint()).contains("rate limiting");

    runner.reset("a");
    TaskView retried = scheduler.retryTask(task.id());
    assertThat(retried.attempt()).isEqualTo(2);
    assertThat(retried.error()).isNull();
    assertThat(retried.status()).isEqualTo(TaskStatus.PROCESSING);

    runner.complete("a", result(false));
    awaitStatus(task.id(), TaskStatus.COMPLETED);
  }

  @Test
  void failure_shouldReleaseSlotWhenRunnerThrowsError() {
    TaskView task = scheduler.addTask("a", METADATA, TaskOptions.defaults());
    TaskView next = scheduler.addTask("b", METADATA, TaskOptions.defaults());
    runner.awaitStarted("a");

    runner.fail("a", new OutOfMemoryError("Java heap space"));

    awaitStatus(task.id(), TaskStatus.FAILED);
    assertThat(scheduler.getTaskById(task.id()).orElseThrow().error())
        .isEqualTo("Java heap space");
    awaitStatus(next.id(), TaskStatus.PROCESSING);
    runner.awaitStarted("b");
  }

  @Test
  void retryTask_shouldFindFailedTaskAfterArchiveEvictions() {
    JobScheduler small =
        new JobScheduler(new TaskRepository(1, Duration.ofMinutes(5)), runner, pool, 1, 60);
    try {
      TaskView first = small.addTask("a", METADATA, TaskOptions.defaults());
      runner.awaitStarted("a");
      runner.fail("a", new IllegalStateException("boom"));
      TaskView second = small.addTask("b", METADATA, TaskOptions.defaults());
      runner.awaitStarted("b");
      runner.fail("b", new IllegalStateException("boom"));
      for (String fileId : List.of("c", "d", "e")) {
        small.addTask(fileId, METADATA, TaskOptions.defaults());
        runner.awaitStarted(fileId);
        runner.complete(fileId, result(false));
        runner.awaitFinished(fileId);
      }

      assertThat(small.getTaskById(first.id()).map(TaskView::status)).contains(TaskStatus.FAILED);
      await()
          .atMost(5, TimeUnit.SECONDS)
          .until(
              () ->
                  small.getTaskById(second.id()).map(TaskView::status).orElse(null)
                      == TaskStatus.FAILED);

      runner.reset("a");
      TaskView retried = small.retryTask(first.id());
      assertThat(retried.attempt()).isEqualTo(2);
      assertThat(small.getTask("a").map(TaskView::id)).contains(first.id());
    } finally {
      small.shutdown();
    }
  }

  @Test
  void retryTask_shouldRejectTaskThatDidNotFail() {
    TaskView task = scheduler.addTask("a", METADATA, TaskOptions.defaults());

    assertThatThrownBy(() -> scheduler.retryTask(task.id()))
        .isInstanceOf(TaskStateException.class);
  }

  @Test
  void partialResult_shouldCompleteWithWarningMessage() {
    TaskView task = scheduler.addTask("a", METADATA, TaskOptions.defaults());
    runner.complete("a", result(true));

    awaitStatus(task.id(), TaskStatus.COMPLETED);
    assertThat(scheduler.getTaskById(task.id()).orElseThrow().message())
        .isEqualTo("Completed with 2 failed chunks");
  }

  @Test
  void progress_shouldBeMonotonicAndStayBelowHundredUntilCompletion() {
    TaskView task = scheduler.addTask("a", METADATA, TaskOptions.defaults());
    runner.awaitStarted("a");
    TaskControl control = runner.control("a");

    control.reportProgress(40, "forty");
    control.reportProgress(20, "backwards");
    control.reportProgress(150, "too far");
    assertThat(scheduler.getTaskById(task.id()).orElseThrow().progress()).isEqualTo(99);

    runner.complete("a", result(false));
    awaitStatus(task.id(), TaskStatus.COMPLETED);

    List<Integer> progress =
        events.stream().filter(e -> e.taskId().equals(task.id())).map(TaskEvent::progress).toList();
    assertThat(progress).isSorted();
    assertThat(progress.get(progress.size() - 1)).isEqualTo(100);
  }

  @Test
  void getStatistics_shouldCountByStatus() {
    TaskView done = scheduler.addTask("a", METADATA, TaskOptions.defaults());
    runner.complete("a", result(false));
    awaitStatus(done.id(), TaskStatus.COMPLETED);
    TaskView failed = scheduler.addTask("b", METADATA, TaskOptions.defaults());
    runner.fail("b", new IllegalStateException("boom"));
    awaitStatus(failed.id(), TaskStatus.FAILED);
    scheduler.addTask("c", METADATA, TaskOptions.defaults());
    scheduler.addTask("d", METADATA, TaskOptions.defaults());

    QueueStatistics stats = scheduler.getStatistics();

    assertThat(stats.countsByStatus())
        .containsEntry(TaskStatus.COMPLETED, 1L)
        .containsEntry(TaskStatus.FAILED, 1L)
        .containsEntry(TaskStatus.PROCESSING, 1L)
        .containsEntry(TaskStatus.QUEUED, 1L);
    assertThat(stats.successRate()).isEqualTo(0.5);
    assertThat(stats.queueLength()).isEqualTo(1);
    assertThat(stats.runningTasks()).isEqualTo(1);
    assertThat(stats.maxConcurrency()).isEqualTo(1);
  }

  @Test
  void clearCompleted_shouldKeepFailedAndActiveTasks() {
    TaskView done = scheduler.addTask("a", METADATA, TaskOptions.defaults());
    runner.complete("a", result(false));
    awaitStatus(done.id(), TaskStatus.COMPLETED);
    TaskView failed = scheduler.addTask("b", METADATA, TaskOptions.defaults());
    runner.fail("b", new IllegalStateException("boom"));
    awaitStatus(failed.id(), TaskStatus.FAILED);

    assertThat(scheduler.clearCompleted()).isEqualTo(1);
    assertThat(scheduler.getTaskById(done.id())).isEmpty();
    assertThat(scheduler.getTaskById(failed.id())).isPresent();
  }

  @Test
  void removeTask_shouldCancelActiveTaskFirst() {
    TaskView task = scheduler.addTask("a", METADATA, TaskOptions.defaults());
    runner.awaitStarted("a");

    assertThat(scheduler.removeTask(task.id())).isTrue();

    assertThat(runner.control("a").isCancelled()).isTrue();
    assertThat(scheduler.getTask("a")).isEmpty();
    assertThat(scheduler.removeTask(task.id())).isFalse();
  }

  @Test
  void shutdown_shouldCancelEverythingAndRefuseNewTasks() {
    TaskView running = scheduler.addTask("a", METADATA, TaskOptions.defaults());
    TaskView queued = scheduler.addTask("b", METADATA, TaskOptions.defaults());

    scheduler.shutdown();

    assertThat(scheduler.getTaskById(running.id()).orElseThrow().status())
        .isEqualTo(TaskStatus.CANCELLED);
    assertThat(scheduler.getTaskById(queued.id()).orElseThrow().status())
        .isEqualTo(TaskStatus.CANCELLED);
    assertThatThrownBy(() -> scheduler.addTask("c", METADATA, TaskOptions.defaults()))
        .isInstanceOf(IllegalStateException.class);
  }

  private void awaitStatus(String taskId, TaskStatus status) {
    await()
        .atMost(5, TimeUnit.SECONDS)
        .until(() -> scheduler.getTaskById(taskId).map(TaskView::status).orElse(null) == status);
  }

  private static TaskOptions withPriority(TaskPriority priority) {
    return new TaskOptions(null, null, 0.0, null, priority, null, null);
  }

  private static TaskResult result(boolean partial) {
    return new TaskResult("transcript-1", "hello", "en", 30, 3, partial, partial ? 2 : 0);
  }

  /** Runner whose outcome per file is decided by the test. */
  private static class ScriptedRunner implements TaskRunner {

    private final Map<String, CompletableFuture<TaskResult>> outcomes = new ConcurrentHashMap<>();
    private final Map<String, CompletableFuture<TaskControl>> started = new ConcurrentHashMap<>();
    private final Map<String, CompletableFuture<Void>> finished = new ConcurrentHashMap<>();

    @Override
    public TaskResult run(TaskView task, TaskControl control) throws Exception {
      String fileId = task.fileId();
      started.computeIfAbsent(fileId, k -> new CompletableFuture<>()).complete(control);
      try {
        return outcome(fileId).get(10, TimeUnit.SECONDS);
      } catch (ExecutionException e) {
        if (e.getCause() instanceof Error) {
          throw (Error) e.getCause();
        }
        throw (Exception) e.getCause();
      } finally {
        finished.computeIfAbsent(fileId, k -> new CompletableFuture<>()).complete(null);
      }
    }

    void complete(String fileId, TaskResult result) {
      outcome(fileId).complete(result);
    }

    void fail(String fileId, Throwable error) {
      outcome(fileId).completeExceptionally(error);
    }

    void reset(String fileId) {
      outcomes.remove(fileId);
      started.remove(fileId);
      finished.remove(fileId);
    }

    TaskControl control(String fileId) {
      return awaitStarted(fileId);
    }

    TaskControl awaitStarted(String fileId) {
      return started.computeIfAbsent(fileId, k -> new CompletableFuture<>()).orTimeout(5, TimeUnit.SECONDS).join();
    }

    void awaitFinished(String fileId) {
      finished.computeIfAbsent(fileId, k -> new CompletableFuture<>()).orTimeout(5, TimeUnit.SECONDS).join();
    }

    void releaseAll() {
      outcomes.values().forEach(f -> f.cancel(false));
    }

    private CompletableFuture<TaskResult> outcome(String fileId) {
      return outcomes.computeIfAbsent(fileId, k -> new CompletableFuture<>());
    }
  }
}
