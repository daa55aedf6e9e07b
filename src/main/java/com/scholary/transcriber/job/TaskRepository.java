package com.scholary.transcriber.job;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.github.benmanes.caffeine.cache.RemovalCause;
import com.scholary.transcriber.config.SchedulerProperties;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Repository;

/**
 * In-memory repository for transcription tasks.
 *
 * <p>Active and failed-but-retryable tasks live in a plain map until they complete, are cancelled
 * or are removed. Completed and cancelled tasks move to a Caffeine cache so they stay queryable for
 * a while without accumulating forever. Only the cache evicts.
 *
 * <p>The file index drops a file's entry when its latest task is evicted from the cache.
 */
@Repository
class TaskRepository {

  private final Map<String, TranscriptionTask> active = new ConcurrentHashMap<>();
  private final Cache<String, TranscriptionTask> finished;
  private final Map<String, String> latestByFile = new ConcurrentHashMap<>();

  @Autowired
  TaskRepository(SchedulerProperties properties) {
    this(
        properties.finishedTaskMaxSize(),
        Duration.ofMinutes(properties.finishedTaskRetentionMinutes()));
  }

  TaskRepository(int maxFinished, Duration retention) {
    this.finished =
        Caffeine.newBuilder()
            .maximumSize(maxFinished)
            .expireAfterWrite(retention)
            .executor(Runnable::run)
            .evictionListener(
                (String taskId, TranscriptionTask task, RemovalCause cause) -> {
                  if (task != null) {
                    latestByFile.remove(task.getFileId(), taskId);
                  }
                })
            .build();
  }

  /** Store or re-activate a task. */
  void save(TranscriptionTask task) {
    finished.invalidate(task.getId());
    active.put(task.getId(), task);
    latestByFile.put(task.getFileId(), task.getId());
  }

  /** Move a completed or cancelled task out of the active set. */
  void archive(TranscriptionTask task) {
    active.remove(task.getId());
    finished.put(task.getId(), task);
  }

  Optional<TranscriptionTask> findById(String taskId) {
    TranscriptionTask task = active.get(taskId);
    if (task == null) {
      task = finished.getIfPresent(taskId);
    }
    return Optional.ofNullable(task);
  }

  /** The queued, processing or paused task of a file, if any. */
  Optional<TranscriptionTask> findActiveByFile(String fileId) {
    return active.values().stream()
        .filter(t -> t.getFileId().equals(fileId) && t.getStatus().isActive())
        .findFirst();
  }

  /** The most recently created or retried task of a file. */
  Optional<TranscriptionTask> findLatestByFile(String fileId) {
    String taskId = latestByFile.get(fileId);
    if (taskId == null) {
      return Optional.empty();
    }
    Optional<TranscriptionTask> task = findById(taskId);
    if (task.isEmpty()) {
      latestByFile.remove(fileId, taskId);
    }
    return task;
  }

  void remove(TranscriptionTask task) {
    active.remove(task.getId());
    finished.invalidate(task.getId());
    latestByFile.remove(task.getFileId(), task.getId());
  }

  /** Number of files with an indexed latest task, after pending evictions ran. */
  int indexedFileCount() {
    finished.cleanUp();
    return latestByFile.size();
  }

  List<TranscriptionTask> findAll() {
    List<TranscriptionTask> all = new ArrayList<>(active.values());
    all.addAll(finished.asMap().values());
    return all;
  }
}
