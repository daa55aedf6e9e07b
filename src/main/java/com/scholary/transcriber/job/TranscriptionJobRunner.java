package com.scholary.transcriber.job;

import com.scholary.transcriber.audio.AudioChunk;
import com.scholary.transcriber.audio.AudioProcessingException;
import com.scholary.transcriber.audio.AudioSegmenter;
import com.scholary.transcriber.batch.BatchConfig;
import com.scholary.transcriber.batch.BatchError;
import com.scholary.transcriber.batch.BatchExecutor;
import com.scholary.transcriber.batch.BatchExecutors;
import com.scholary.transcriber.batch.BatchOperationResult;
import com.scholary.transcriber.config.TranscriptionProperties;
import com.scholary.transcriber.config.TranscriptionProperties.ChunkingProperties;
import com.scholary.transcriber.error.ErrorKind;
import com.scholary.transcriber.error.TranscriberException;
import com.scholary.transcriber.logging.StructuredLogger;
import com.scholary.transcriber.store.FileRecord;
import com.scholary.transcriber.store.FileUploadService;
import com.scholary.transcriber.store.StoredSegment;
import com.scholary.transcriber.store.TranscriptRecord;
import com.scholary.transcriber.store.TranscriptStatus;
import com.scholary.transcriber.store.TranscriptStore;
import com.scholary.transcriber.transcription.AudioSource;
import com.scholary.transcriber.transcription.TranscriptionClient;
import com.scholary.transcriber.transcription.TranscriptionOptions;
import com.scholary.transcriber.transcription.TranscriptionResult;
import com.scholary.transcriber.transcription.TranscriptionSegment;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.stream.Collectors;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Runs one transcription task end to end.
 *
 * <p>This is the workhorse behind the scheduler. It:
 *
 * <ol>
 *   <li>Loads the file from the store, reassembling storage chunks of large files
 *   <li>Slices long recordings into overlapping chunks, short ones go through whole
 *   <li>Transcribes the chunks through the batch executor, which retries transient failures
 *   <li>Moves segments to absolute time and cuts the overlaps
 *   <li>Persists the transcript and its segments
 * </ol>
 *
 * <p>Progress: 0-10% loading and slicing, 10-90% chunks, 90-100% persisting.
 *
 * <p>A run with some failed chunks still completes with the segments it has; it only fails when no
 * chunk could be transcribed or when a failure that retrying cannot fix occurred.
 */
@Component
public class TranscriptionJobRunner implements TaskRunner {

  private static final Logger LOGGER = LoggerFactory.getLogger(TranscriptionJobRunner.class);
  private static final StructuredLogger STRUCTURED_LOGGER = new StructuredLogger(LOGGER);

  private final TranscriptStore store;
  private final FileUploadService files;
  private final AudioSegmenter segmenter;
  private final TranscriptionClient client;
  private final BatchExecutors batchExecutors;
  private final ChunkingProperties chunking;

  public TranscriptionJobRunner(
      TranscriptStore store,
      FileUploadService files,
      AudioSegmenter segmenter,
      TranscriptionClient client,
      BatchExecutors batchExecutors,
      TranscriptionProperties properties) {
    this.store = store;
    this.files = files;
    this.segmenter = segmenter;
    this.client = client;
    this.batchExecutors = batchExecutors;
    this.chunking = properties.chunking();
  }

  @Override
  public TaskResult run(TaskView task, TaskControl control) throws Exception {
    long startMs = System.currentTimeMillis();
    String fileId = task.fileId();

    control.reportProgress(1, "Loading audio");
    FileRecord file =
        store
            .getFile(fileId)
            .orElseThrow(() -> new IllegalArgumentException("File not found: " + fileId));
    byte[] audio = files.loadAudio(file);

    Double duration = resolveDuration(file, audio);
    control.checkpoint();

    List<WorkUnit> units = plan(file, audio, duration, task.options());
    control.reportProgress(10, String.format("Transcribing %d chunks", units.size()));

    List<ChunkTranscript> transcripts = transcribe(task, units, control);
    control.checkpoint();

    int failedChunks = units.size() - transcripts.size();
    List<TranscriptionSegment> segments = TranscriptAssembler.assemble(transcripts);
    String text = segments.stream().map(TranscriptionSegment::text).collect(Collectors.joining(" "));
    String language =
        transcripts.stream()
            .map(t -> t.result().language())
            .filter(Objects::nonNull)
            .findFirst()
            .orElse(task.options().language());

    double totalDuration =
        duration != null
            ? duration
            : transcripts.stream().mapToDouble(t -> t.result().duration()).max().orElse(0);

    control.reportProgress(90, "Saving transcript");
    String transcriptId =
        persist(fileId, text, language, segments, System.currentTimeMillis() - startMs);

    if (failedChunks > 0) {
      LOGGER.warn(
          "Task {} completed with {} of {} chunks missing", task.id(), failedChunks, units.size());
    }
    LOGGER.info(
        "Task {} transcribed: transcript={}, segments={}, took={}ms",
        task.id(),
        transcriptId,
        segments.size(),
        System.currentTimeMillis() - startMs);

    return new TaskResult(
        transcriptId,
        text,
        language,
        totalDuration,
        segments.size(),
        failedChunks > 0,
        failedChunks);
  }

  /** Stored or probed duration, or null when the format cannot be decoded locally. */
  private Double resolveDuration(FileRecord file, byte[] audio) {
    if (file.duration() != null) {
      return file.duration();
    }
    double duration;
    try {
      duration = segmenter.probeDuration(audio, file.id());
    } catch (AudioProcessingException e) {
      if (e.getKind() != ErrorKind.DECODE_FAILED) {
        throw e;
      }
      LOGGER.warn(
          "Duration of file {} unknown, sending it whole: {}", file.id(), e.getMessage());
      return null;
    }
    store.updateFileDuration(file.id(), duration);
    return duration;
  }

  /** One transcription call: a chunk of a long file, or the whole of a short one. */
  private record WorkUnit(int index, double startTime, double endTime, AudioSource source) {}

  private List<WorkUnit> plan(FileRecord file, byte[] audio, Double duration, TaskOptions options) {
    if (duration == null || duration <= chunking.chunkThresholdSeconds()) {
      // The provider decodes formats we cannot slice, such as M4A
      return List.of(
          new WorkUnit(
              0,
              0,
              duration != null ? duration : 0,
              new AudioSource(file.name(), file.contentType(), audio, file.lastModified())));
    }

    List<AudioChunk> chunks =
        segmenter.slice(
            audio,
            file.id(),
            0,
            duration,
            options.chunkSecondsOr(chunking.chunkSeconds()),
            options.overlapSecondsOr(chunking.overlapSeconds()));
    List<WorkUnit> units = new ArrayList<>(chunks.size());
    for (AudioChunk chunk : chunks) {
      // Chunk names feed the cache key, so they must differ per window
      String name = String.format("%s.part%03d.wav", file.name(), chunk.index());
      units.add(
          new WorkUnit(
              chunk.index(),
              chunk.startTime(),
              chunk.endTime(),
              new AudioSource(name, "audio/wav", chunk.data(), file.lastModified())));
    }
    LOGGER.info("Sliced file {} ({}s) into {} chunks", file.id(), duration, units.size());
    return units;
  }

  private List<ChunkTranscript> transcribe(TaskView task, List<WorkUnit> units, TaskControl control)
      throws InterruptedException {
    BatchConfig defaults = batchExecutors.getDefaults();
    BatchExecutor<WorkUnit, ChunkTranscript> executor =
        batchExecutors.create(defaults.withSizing(1, defaults.maxConcurrentBatches()));
    TranscriptionOptions options = task.options().toTranscriptionOptions();
    AtomicInteger done = new AtomicInteger();

    BatchOperationResult<ChunkTranscript> outcome =
        executor.process(
            units,
            (batch, batchIndex) -> {
              List<ChunkTranscript> results = new ArrayList<>(batch.size());
              for (WorkUnit unit : batch) {
                control.checkpoint();
                STRUCTURED_LOGGER.logChunkStarted(unit.index(), unit.startTime(), unit.endTime());
                long chunkStart = System.currentTimeMillis();

                TranscriptionResult result = client.transcribe(unit.source(), options);

                STRUCTURED_LOGGER.logChunkFinished(
                    unit.index(),
                    unit.startTime(),
                    unit.endTime(),
                    result.segments().size(),
                    System.currentTimeMillis() - chunkStart);
                results.add(
                    new ChunkTranscript(unit.index(), unit.startTime(), unit.endTime(), result));

                int finished = done.incrementAndGet();
                int percent = 10 + 80 * finished / units.size();
                STRUCTURED_LOGGER.logJobProgress(
                    task.id(), finished, units.size(), percent, "transcribing");
                control.reportProgress(
                    percent, String.format("Transcribed %d of %d chunks", finished, units.size()));
              }
              return results;
            });

    // Failures caused by a cancel are not the task's failures
    control.checkpoint();
    if (!outcome.hasErrors()) {
      return outcome.results();
    }

    for (BatchError error : outcome.errors()) {
      if (error.cause() instanceof TranscriberException
          && !((TranscriberException) error.cause()).isRetryable()) {
        throw (TranscriberException) error.cause();
      }
    }
    if (outcome.results().isEmpty()) {
      BatchError first = outcome.errors().get(0);
      if (first.cause() instanceof TranscriberException) {
        throw (TranscriberException) first.cause();
      }
      throw new TranscriberException(
          ErrorKind.TRANSCRIPTION_FAILED,
          String.format("All %d chunks failed: %s", units.size(), first.message()),
          first.cause());
    }
    return outcome.results();
  }

  private String persist(
      String fileId,
      String text,
      String language,
      List<TranscriptionSegment> segments,
      long processingTimeMs) {
    Instant now = Instant.now();
    String transcriptId =
        store.addTranscript(
            new TranscriptRecord(
                null, fileId, TranscriptStatus.PROCESSING, text, language, processingTimeMs, now, now));

    List<StoredSegment> stored =
        segments.stream()
            .map(
                s ->
                    new StoredSegment(
                        null,
                        transcriptId,
                        s.start(),
                        s.end(),
                        s.text(),
                        s.wordTimestamps(),
                        s.confidence()))
            .toList();

    BatchExecutor<StoredSegment, Long> writer = batchExecutors.forDatabase();
    BatchOperationResult<Long> written =
        writer.process(stored, (batch, batchIndex) -> store.addSegments(transcriptId, batch));
    if (!written.success()) {
      store.updateTranscriptStatus(transcriptId, TranscriptStatus.FAILED);
      BatchError first = written.errors().get(0);
      throw new IllegalStateException(
          String.format(
              "Saved %d of %d segments of transcript %s: %s",
              written.processedItems(), stored.size(), transcriptId, first.message()),
          first.cause());
    }

    store.updateTranscriptStatus(transcriptId, TranscriptStatus.COMPLETED);
    return transcriptId;
  }
}
