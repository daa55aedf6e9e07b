package com.scholary.transcriber.api;

import com.scholary.transcriber.job.JobScheduler;
import com.scholary.transcriber.store.FileRecord;
import com.scholary.transcriber.store.FileUploadService;
import com.scholary.transcriber.store.TranscriptRecord;
import com.scholary.transcriber.store.TranscriptStore;
import com.scholary.transcriber.transcription.AudioSource;
import com.scholary.transcriber.transcription.TranscriptionClient;
import com.scholary.transcriber.transcription.TranscriptionClient.UsageStats;
import com.scholary.transcriber.transcription.TranscriptionOptions;
import com.scholary.transcriber.transcription.TranscriptionResult;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import java.io.IOException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.multipart.MultipartFile;
import org.springframework.web.server.ResponseStatusException;

/**
 * REST API for audio files and transcripts.
 *
 * <p>Provides endpoints for:
 *
 * <ul>
 *   <li>Uploading audio and reading it back
 *   <li>Fetching the transcript of a file
 *   <li>Synchronous transcription of short recordings, without storing anything
 * </ul>
 *
 * <p>Long recordings should go through the task API instead, which chunks them and reports progress.
 */
@RestController
@Tag(name = "Transcription", description = "Audio upload and transcript API")
public class TranscriptionController {

  private static final Logger LOGGER = LoggerFactory.getLogger(TranscriptionController.class);

  private final FileUploadService uploadService;
  private final TranscriptStore store;
  private final TranscriptionClient client;
  private final JobScheduler scheduler;

  public TranscriptionController(
      FileUploadService uploadService,
      TranscriptStore store,
      TranscriptionClient client,
      JobScheduler scheduler) {
    this.uploadService = uploadService;
    this.store = store;
    this.client = client;
    this.scheduler = scheduler;
  }

  /**
   * Upload an audio file.
   *
   * <p>{@code lastModified} is part of the transcription cache identity; pass the source file's
   * modification time so re-uploads of the same file hit the cache.
   */
  @PostMapping(value = "/api/files", consumes = MediaType.MULTIPART_FORM_DATA_VALUE)
  @Operation(summary = "Upload audio", description = "Store an audio file for later transcription")
  public ResponseEntity<FileResponse> upload(
      @RequestParam("file") MultipartFile file,
      @RequestParam(value = "lastModified", defaultValue = "0") long lastModified)
      throws IOException {
    if (file.isEmpty()) {
      throw new IllegalArgumentException("Uploaded file is empty");
    }
    LOGGER.info("Upload request: name={}, size={}", file.getOriginalFilename(), file.getSize());

    FileRecord stored =
        uploadService.upload(
            file.getOriginalFilename(), file.getContentType(), file.getBytes(), lastModified);
    return ResponseEntity.status(HttpStatus.CREATED).body(FileResponse.from(stored));
  }

  @GetMapping("/api/files/{fileId}")
  @Operation(summary = "Get file", description = "Metadata of an uploaded file")
  public FileResponse getFile(@PathVariable String fileId) {
    return FileResponse.from(requireFile(fileId));
  }

  /** Delete a file with its transcripts, cancelling its task first when one is active. */
  @DeleteMapping("/api/files/{fileId}")
  @Operation(summary = "Delete file", description = "Delete a file, its transcripts and segments")
  public ResponseEntity<Void> deleteFile(@PathVariable String fileId) {
    scheduler
        .getTask(fileId)
        .filter(task -> task.status().isActive())
        .ifPresent(task -> scheduler.cancelTask(task.id()));

    if (!store.deleteFile(fileId)) {
      throw new ResponseStatusException(HttpStatus.NOT_FOUND, "File not found: " + fileId);
    }
    LOGGER.info("Deleted file {}", fileId);
    return ResponseEntity.noContent().build();
  }

  @GetMapping("/api/files/{fileId}/transcript")
  @Operation(
      summary = "Get transcript",
      description = "Latest transcript of a file with its segments ordered by start time")
  public TranscriptResponse getTranscript(@PathVariable String fileId) {
    requireFile(fileId);
    TranscriptRecord transcript =
        store.getTranscriptsByFile(fileId).stream()
            .findFirst()
            .orElseThrow(
                () ->
                    new ResponseStatusException(
                        HttpStatus.NOT_FOUND, "File " + fileId + " has no transcript"));
    return new TranscriptResponse(transcript, store.getSegmentsByTranscript(transcript.id()));
  }

  /** Transcribe a recording in the request thread, retrying transient provider failures. */
  @PostMapping(value = "/api/transcribe", consumes = MediaType.MULTIPART_FORM_DATA_VALUE)
  @Operation(
      summary = "Transcribe synchronously",
      description = "Transcribe a short recording and return the result directly")
  public TranscriptionResult transcribe(
      @RequestParam("file") MultipartFile file,
      @RequestParam(value = "language", required = false) String language,
      @RequestParam(value = "model", required = false) String model,
      @RequestParam(value = "temperature", defaultValue = "0.0") double temperature,
      @RequestParam(value = "prompt", required = false) String prompt,
      @RequestParam(value = "lastModified", defaultValue = "0") long lastModified)
      throws IOException {
    if (file.isEmpty()) {
      throw new IllegalArgumentException("Uploaded file is empty");
    }
    LOGGER.info("Synchronous transcription: name={}, size={}", file.getOriginalFilename(), file.getSize());

    AudioSource source =
        new AudioSource(
            file.getOriginalFilename(), file.getContentType(), file.getBytes(), lastModified);
    return client.transcribeWithRetry(
        source, new TranscriptionOptions(language, model, temperature, prompt, null));
  }

  @GetMapping("/api/usage")
  @Operation(summary = "Provider usage", description = "Request, error and cache counters")
  public UsageStats usage() {
    return client.getUsageStats();
  }

  private FileRecord requireFile(String fileId) {
    return store
        .getFile(fileId)
        .orElseThrow(
            () -> new ResponseStatusException(HttpStatus.NOT_FOUND, "File not found: " + fileId));
  }
}
