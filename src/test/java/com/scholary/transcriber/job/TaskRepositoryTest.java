package com.scholary.transcriber.job;

import static org.assertj.core.api.Assertions.assertThat;

import java.time.Duration;
import org.junit.jupiter.api.Test;

class TaskRepositoryTest {

  private static final TaskMetadata METADATA =
      new TaskMetadata("talk.wav", 1024, 30.0, "wav", null);

  private final TaskRepository repository = new TaskRepository(1, Duration.ofMinutes(5));

  @Test
  void archive_shouldDropFileIndexOfEvictedTasks() {
    for (int i = 0; i < 5; i++) {
      TranscriptionTask task = task("task-" + i, "file-" + i);
      repository.save(task);
      repository.archive(task);
    }

    // One archived task survives, so one file stays indexed
    assertThat(repository.indexedFileCount()).isEqualTo(1);
  }

  @Test
  void save_shouldKeepActiveTasksIndexedRegardlessOfArchiveSize() {
    TranscriptionTask waiting = task("task-a", "file-a");
    repository.save(waiting);
    for (int i = 0; i < 3; i++) {
      TranscriptionTask done = task("done-" + i, "done-file-" + i);
      repository.save(done);
      repository.archive(done);
    }

    assertThat(repository.findLatestByFile("file-a")).contains(waiting);
    assertThat(repository.indexedFileCount()).isEqualTo(2);
  }

  @Test
  void remove_shouldForgetTaskAndItsFile() {
    TranscriptionTask task = task("task-1", "file-1");
    repository.save(task);

    repository.remove(task);

    assertThat(repository.findById("task-1")).isEmpty();
    assertThat(repository.findLatestByFile("file-1")).isEmpty();
    assertThat(repository.indexedFileCount()).isZero();
  }

  private static TranscriptionTask task(String id, String fileId) {
    return new TranscriptionTask(id, fileId, METADATA, TaskOptions.defaults());
  }
}
