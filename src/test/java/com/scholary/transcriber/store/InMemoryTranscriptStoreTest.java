package com.scholary.transcriber.store;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.time.Instant;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class InMemoryTranscriptStoreTest {

  private InMemoryChunkStorage chunkStorage;
  private InMemoryTranscriptStore store;

  @BeforeEach
  void setUp() {
    chunkStorage = new InMemoryChunkStorage();
    store = new InMemoryTranscriptStore(chunkStorage);
  }

  @Test
  void addFile_shouldAssignIdWhenMissing() {
    String id = store.addFile(file(null));

    assertThat(id).isNotBlank();
    assertThat(store.getFile(id)).get().extracting(FileRecord::id).isEqualTo(id);
  }

  @Test
  void updateFileDuration_shouldRejectUnknownFile() {
    assertThatThrownBy(() -> store.updateFileDuration("missing", 3.0))
        .isInstanceOf(IllegalArgumentException.class);
  }

  @Test
  void getSegmentsByTranscript_shouldOrderByStartTime() {
    String transcriptId = store.addTranscript(transcript("file-1", Instant.now()));

    List<Long> ids =
        store.addSegments(transcriptId, List.of(segment(transcriptId, 5), segment(transcriptId, 1)));
    store.addSegments(transcriptId, List.of(segment(transcriptId, 3)));

    assertThat(ids).hasSize(2).doesNotContainNull();
    assertThat(store.getSegmentsByTranscript(transcriptId))
        .extracting(StoredSegment::start)
        .containsExactly(1.0, 3.0, 5.0);
  }

  @Test
  void getTranscriptsByFile_shouldReturnNewestFirst() {
    Instant now = Instant.now();
    String older = store.addTranscript(transcript("file-1", now.minusSeconds(60)));
    String newer = store.addTranscript(transcript("file-1", now));
    store.addTranscript(transcript("file-2", now));

    assertThat(store.getTranscriptsByFile("file-1"))
        .extracting(TranscriptRecord::id)
        .containsExactly(newer, older);
  }

  @Test
  void updateTranscriptStatus_shouldChangeStatus() {
    String id = store.addTranscript(transcript("file-1", Instant.now()));

    store.updateTranscriptStatus(id, TranscriptStatus.COMPLETED);

    assertThat(store.getTranscript(id).orElseThrow().status()).isEqualTo(TranscriptStatus.COMPLETED);
  }

  @Test
  void deleteFile_shouldCascadeToChunksTranscriptsAndSegments() {
    String fileId = store.addFile(file(null));
    store.putChunk(fileId, 0, new byte[] {1});
    String transcriptId = store.addTranscript(transcript(fileId, Instant.now()));
    store.addSegments(transcriptId, List.of(segment(transcriptId, 0)));

    assertThat(store.deleteFile(fileId)).isTrue();

    assertThat(store.getFile(fileId)).isEmpty();
    assertThat(chunkStorage.getAll(fileId)).isEmpty();
    assertThat(store.getTranscript(transcriptId)).isEmpty();
    assertThat(store.getSegmentsByTranscript(transcriptId)).isEmpty();
    assertThat(store.deleteFile(fileId)).isFalse();
  }

  @Test
  void getChunks_shouldReturnPiecesInIndexOrder() {
    store.putChunk("file-1", 1, new byte[] {2});
    store.putChunk("file-1", 0, new byte[] {1});

    assertThat(store.getChunks("file-1")).containsExactly(new byte[] {1}, new byte[] {2});
  }

  private static FileRecord file(String id) {
    return new FileRecord(id, "a.wav", "audio/wav", 3, 0L, null, new byte[] {1, 2, 3}, false, 0, Instant.now());
  }

  private static TranscriptRecord transcript(String fileId, Instant createdAt) {
    return new TranscriptRecord(
        null, fileId, TranscriptStatus.PROCESSING, "text", "en", 10, createdAt, createdAt);
  }

  private static StoredSegment segment(String transcriptId, double start) {
    return new StoredSegment(null, transcriptId, start, start + 1, "s", List.of(), 0.9);
  }
}
