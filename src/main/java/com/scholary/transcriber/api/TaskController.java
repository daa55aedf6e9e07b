package com.scholary.transcriber.api;

import com.scholary.transcriber.event.ProgressFeed.Subscription;
import com.scholary.transcriber.job.JobScheduler;
import com.scholary.transcriber.job.QueuePosition;
import com.scholary.transcriber.job.QueueStatistics;
import com.scholary.transcriber.job.TaskMetadata;
import com.scholary.transcriber.job.TaskNotFoundException;
import com.scholary.transcriber.job.TaskOptions;
import com.scholary.transcriber.job.TaskView;
import com.scholary.transcriber.store.FileRecord;
import com.scholary.transcriber.store.TranscriptStore;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import java.io.IOException;
import java.util.List;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.server.ResponseStatusException;
import org.springframework.web.servlet.mvc.method.annotation.SseEmitter;

/**
 * REST API for background transcription tasks.
 *
 * <p>A task is started per uploaded file and then polled, or followed through the server-sent event
 * stream. Illegal state changes (pausing a queued task, retrying a completed one) answer 409.
 */
@RestController
@Tag(name = "Tasks", description = "Background transcription task API")
public class TaskController {

  private static final Logger LOGGER = LoggerFactory.getLogger(TaskController.class);

  // Event streams stay open until the client goes away
  private static final long SSE_TIMEOUT_MS = 0L;

  private final JobScheduler scheduler;
  private final TranscriptStore store;

  public TaskController(JobScheduler scheduler, TranscriptStore store) {
    this.scheduler = scheduler;
    this.store = store;
  }

  @PostMapping("/api/files/{fileId}/tasks")
  @Operation(
      summary = "Start transcription",
      description = "Queue a background transcription of an uploaded file")
  public ResponseEntity<TaskView> startTask(
      @PathVariable String fileId, @Valid @RequestBody(required = false) StartTaskRequest request) {
    FileRecord file =
        store
            .getFile(fileId)
            .orElseThrow(
                () -> new ResponseStatusException(HttpStatus.NOT_FOUND, "File not found: " + fileId));
    TaskOptions options = request != null ? request.toOptions() : TaskOptions.defaults();
    TaskMetadata metadata =
        new TaskMetadata(file.name(), file.size(), file.duration(), file.format(), options.language());

    TaskView task = scheduler.addTask(fileId, metadata, options);
    LOGGER.info("Started task {} for file {} ({})", task.id(), fileId, task.status());
    return ResponseEntity.accepted().body(task);
  }

  @GetMapping("/api/files/{fileId}/task")
  @Operation(summary = "Get task of file", description = "The most recent task of a file")
  public TaskView getTaskOfFile(@PathVariable String fileId) {
    return scheduler
        .getTask(fileId)
        .orElseThrow(() -> new TaskNotFoundException("No task for file: " + fileId));
  }

  @GetMapping("/api/tasks/{taskId}")
  @Operation(summary = "Get task", description = "Status, progress and result of a task")
  public TaskView getTask(@PathVariable String taskId) {
    return scheduler
        .getTaskById(taskId)
        .orElseThrow(() -> new TaskNotFoundException("Task not found: " + taskId));
  }

  @PostMapping("/api/tasks/{taskId}/cancel")
  @Operation(summary = "Cancel task", description = "Cancel a queued, running or paused task")
  public TaskView cancel(@PathVariable String taskId) {
    return scheduler.cancelTask(taskId);
  }

  @PostMapping("/api/tasks/{taskId}/pause")
  @Operation(summary = "Pause task", description = "Stop dispatching chunks of a running task")
  public TaskView pause(@PathVariable String taskId) {
    return scheduler.pauseTask(taskId);
  }

  @PostMapping("/api/tasks/{taskId}/resume")
  @Operation(summary = "Resume task", description = "Continue a paused task")
  public TaskView resume(@PathVariable String taskId) {
    return scheduler.resumeTask(taskId);
  }

  @PostMapping("/api/tasks/{taskId}/retry")
  @Operation(summary = "Retry task", description = "Queue a failed task again")
  public TaskView retry(@PathVariable String taskId) {
    return scheduler.retryTask(taskId);
  }

  @DeleteMapping("/api/tasks/{taskId}")
  @Operation(summary = "Remove task", description = "Forget a task, cancelling it when active")
  public ResponseEntity<Void> remove(@PathVariable String taskId) {
    if (!scheduler.removeTask(taskId)) {
      throw new TaskNotFoundException("Task not found: " + taskId);
    }
    return ResponseEntity.noContent().build();
  }

  @GetMapping("/api/tasks/queue")
  @Operation(summary = "List queue", description = "Queued tasks in dispatch order")
  public List<TaskView> queue() {
    return scheduler.listQueue();
  }

  /** Queue position of a task; 204 when the task is not waiting in the queue. */
  @GetMapping("/api/tasks/{taskId}/position")
  @Operation(summary = "Queue position", description = "Position and estimated wait of a queued task")
  public ResponseEntity<QueuePosition> position(@PathVariable String taskId) {
    return scheduler
        .getQueuePosition(taskId)
        .map(ResponseEntity::ok)
        .orElse(ResponseEntity.noContent().build());
  }

  @GetMapping("/api/tasks/statistics")
  @Operation(summary = "Statistics", description = "Task counts, success rate and queue length")
  public QueueStatistics statistics() {
    return scheduler.getStatistics();
  }

  @PostMapping("/api/tasks/clear-completed")
  @Operation(summary = "Clear finished tasks", description = "Forget completed and cancelled tasks")
  public Map<String, Integer> clearCompleted() {
    return Map.of("removed", scheduler.clearCompleted());
  }

  /**
   * Stream task events as server-sent events.
   *
   * @param taskId only events of this task when given
   */
  @GetMapping(value = "/api/tasks/events", produces = MediaType.TEXT_EVENT_STREAM_VALUE)
  @Operation(summary = "Task events", description = "Server-sent stream of status and progress changes")
  public SseEmitter events(@RequestParam(value = "taskId", required = false) String taskId) {
    SseEmitter emitter = new SseEmitter(SSE_TIMEOUT_MS);
    Subscription subscription =
        scheduler
            .events()
            .subscribe(
                event -> {
                  if (taskId != null && !taskId.equals(event.taskId())) {
                    return;
                  }
                  try {
                    emitter.send(SseEmitter.event().name("task").data(event));
                  } catch (IOException e) {
                    LOGGER.debug("Event stream closed by client: {}", e.getMessage());
                    emitter.completeWithError(e);
                  }
                });

    emitter.onCompletion(subscription::close);
    emitter.onTimeout(subscription::close);
    emitter.onError(e -> subscription.close());
    return emitter;
  }
}
