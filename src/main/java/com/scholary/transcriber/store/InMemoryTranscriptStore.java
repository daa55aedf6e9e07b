package com.scholary.transcriber.store;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicLong;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Repository;

/**
 * In-memory implementation of {@link TranscriptStore}.
 *
 * <p>Fine for a single instance; everything is lost on restart. Pieces of large files go to the
 * configured {@link ChunkStorage}, which may be object storage.
 */
@Repository
public class InMemoryTranscriptStore implements TranscriptStore {

  private static final Logger LOGGER = LoggerFactory.getLogger(InMemoryTranscriptStore.class);

  private final Map<String, FileRecord> files = new ConcurrentHashMap<>();
  private final Map<String, TranscriptRecord> transcripts = new ConcurrentHashMap<>();
  private final Map<String, List<StoredSegment>> segments = new ConcurrentHashMap<>();
  private final AtomicLong segmentIds = new AtomicLong();
  private final ChunkStorage chunkStorage;

  public InMemoryTranscriptStore(ChunkStorage chunkStorage) {
    this.chunkStorage = chunkStorage;
  }

  @Override
  public String addFile(FileRecord file) {
    String id = file.id() != null ? file.id() : UUID.randomUUID().toString();
    files.put(id, file.withId(id));
    LOGGER.debug("Stored file: {}", id);
    return id;
  }

  @Override
  public Optional<FileRecord> getFile(String fileId) {
    return Optional.ofNullable(files.get(fileId));
  }

  @Override
  public void updateFileDuration(String fileId, double durationSeconds) {
    FileRecord updated = files.computeIfPresent(fileId, (id, file) -> file.withDuration(durationSeconds));
    if (updated == null) {
      throw new IllegalArgumentException("Unknown file: " + fileId);
    }
  }

  @Override
  public boolean deleteFile(String fileId) {
    FileRecord removed = files.remove(fileId);
    if (removed == null) {
      return false;
    }
    chunkStorage.deleteAll(fileId);
    for (TranscriptRecord transcript : getTranscriptsByFile(fileId)) {
      transcripts.remove(transcript.id());
      segments.remove(transcript.id());
    }
    LOGGER.info("Deleted file {}", fileId);
    return true;
  }

  @Override
  public String addTranscript(TranscriptRecord transcript) {
    String id = transcript.id() != null ? transcript.id() : UUID.randomUUID().toString();
    transcripts.put(id, transcript.withId(id));
    LOGGER.debug("Stored transcript: id={}, fileId={}", id, transcript.fileId());
    return id;
  }

  @Override
  public Optional<TranscriptRecord> getTranscript(String transcriptId) {
    return Optional.ofNullable(transcripts.get(transcriptId));
  }

  @Override
  public void updateTranscriptStatus(String transcriptId, TranscriptStatus status) {
    TranscriptRecord updated =
        transcripts.computeIfPresent(transcriptId, (id, t) -> t.withStatus(status, Instant.now()));
    if (updated == null) {
      throw new IllegalArgumentException("Unknown transcript: " + transcriptId);
    }
  }

  @Override
  public List<TranscriptRecord> getTranscriptsByFile(String fileId) {
    return transcripts.values().stream()
        .filter(t -> t.fileId().equals(fileId))
        .sorted(Comparator.comparing(TranscriptRecord::createdAt).reversed())
        .toList();
  }

  @Override
  public List<Long> addSegments(String transcriptId, List<StoredSegment> newSegments) {
    List<StoredSegment> target = segments.computeIfAbsent(transcriptId, id -> new CopyOnWriteArrayList<>());
    List<Long> ids = new ArrayList<>(newSegments.size());
    List<StoredSegment> stored = new ArrayList<>(newSegments.size());
    for (StoredSegment segment : newSegments) {
      long id = segmentIds.incrementAndGet();
      stored.add(segment.withId(id));
      ids.add(id);
    }
    target.addAll(stored);
    return ids;
  }

  @Override
  public List<StoredSegment> getSegmentsByTranscript(String transcriptId) {
    return segments.getOrDefault(transcriptId, List.of()).stream()
        .sorted(Comparator.comparingDouble(StoredSegment::start))
        .toList();
  }

  @Override
  public void putChunk(String fileId, int index, byte[] data) {
    chunkStorage.put(fileId, index, data);
  }

  @Override
  public List<byte[]> getChunks(String fileId) {
    return chunkStorage.getAll(fileId);
  }
}
