package com.scholary.transcriber.logging;

import org.slf4j.Logger;
import org.slf4j.MDC;

/**
 * Utility for structured logging with MDC (Mapped Diagnostic Context).
 *
 * <p>Provides methods to log pipeline events with structured fields that can be queried in Kibana.
 * Task context ({@code task_id}, {@code file_id}) is set once per worker thread and survives
 * individual events; event fields are cleared after each call.
 */
public class StructuredLogger {

  private final Logger logger;

  public StructuredLogger(Logger logger) {
    this.logger = logger;
  }

  /** Log chunk started event. */
  public void logChunkStarted(int chunkIndex, double start, double end) {
    try {
      MDC.put("event_type", "chunk_started");
      MDC.put("chunk_index", String.valueOf(chunkIndex));
      MDC.put("start", String.valueOf(start));
      MDC.put("end", String.valueOf(end));

      logger.debug("Chunk started: index={}, range=[{}-{}]", chunkIndex, start, end);
    } finally {
      clearEventFields();
    }
  }

  /** Log chunk finished event. */
  public void logChunkFinished(int chunkIndex, double start, double end, int segments, long transcribeMs) {
    try {
      MDC.put("event_type", "chunk_finished");
      MDC.put("chunk_index", String.valueOf(chunkIndex));
      MDC.put("start", String.valueOf(start));
      MDC.put("end", String.valueOf(end));
      MDC.put("segments", String.valueOf(segments));
      MDC.put("transcribeMs", String.valueOf(transcribeMs));

      logger.debug(
          "Chunk finished: index={}, range=[{}-{}], segments={}, transcribe={}ms",
          chunkIndex,
          start,
          end,
          segments,
          transcribeMs);
    } finally {
      clearEventFields();
    }
  }

  /** Log batch retry event. */
  public void logBatchRetry(
      int batchIndex, int attempt, int maxRetries, long delayMs, String errorType, String message) {
    try {
      MDC.put("event_type", "batch_retry");
      MDC.put("batch_index", String.valueOf(batchIndex));
      MDC.put("attempt", String.valueOf(attempt));
      MDC.put("maxRetries", String.valueOf(maxRetries));
      MDC.put("delayMs", String.valueOf(delayMs));
      MDC.put("errorType", errorType);

      logger.warn(
          "Batch retry: batch={}, attempt={}/{}, delay={}ms, error={}, message={}",
          batchIndex,
          attempt,
          maxRetries,
          delayMs,
          errorType,
          message);
    } finally {
      clearEventFields();
    }
  }

  /** Log batch failure event. */
  public void logBatchFailed(int batchIndex, int attempts, String errorType, String message) {
    try {
      MDC.put("event_type", "batch_failed");
      MDC.put("batch_index", String.valueOf(batchIndex));
      MDC.put("attempt", String.valueOf(attempts));
      MDC.put("errorType", errorType);

      logger.error(
          "Batch failed: batch={}, attempts={}, error={}, message={}",
          batchIndex,
          attempts,
          errorType,
          message);
    } finally {
      clearEventFields();
    }
  }

  /** Log transcription retry event. */
  public void logTranscribeRetry(int attempt, int maxAttempts, long delayMs, String errorType, String message) {
    try {
      MDC.put("event_type", "transcribe_retry");
      MDC.put("attempt", String.valueOf(attempt));
      MDC.put("maxRetries", String.valueOf(maxAttempts));
      MDC.put("delayMs", String.valueOf(delayMs));
      MDC.put("errorType", errorType);

      logger.warn(
          "Transcribe retry: attempt={}/{}, delay={}ms, error={}, message={}",
          attempt,
          maxAttempts,
          delayMs,
          errorType,
          message);
    } finally {
      clearEventFields();
    }
  }

  /** Log task state transition. */
  public void logTaskTransition(String taskId, String fileId, String from, String to) {
    try {
      MDC.put("event_type", "task_transition");
      MDC.put("fromStatus", from);
      MDC.put("toStatus", to);

      logger.info("Task transition: taskId={}, fileId={}, {} -> {}", taskId, fileId, from, to);
    } finally {
      clearEventFields();
    }
  }

  /** Log job progress event. */
  public void logJobProgress(
      String taskId, int chunksProcessed, int totalChunks, int percentComplete, String phase) {
    try {
      MDC.put("event_type", "job_progress");
      MDC.put("chunksProcessed", String.valueOf(chunksProcessed));
      MDC.put("totalChunks", String.valueOf(totalChunks));
      MDC.put("percentComplete", String.valueOf(percentComplete));
      MDC.put("phase", phase);

      logger.info(
          "Job progress: taskId={}, phase={}, chunks={}/{}, progress={}%",
          taskId,
          phase,
          chunksProcessed,
          totalChunks,
          percentComplete);
    } finally {
      clearEventFields();
    }
  }

  /** Set task context in MDC. */
  public static void setTaskContext(String taskId, String fileId) {
    MDC.put("task_id", taskId);
    MDC.put("file_id", fileId);
  }

  /** Clear task context from MDC. */
  public static void clearTaskContext() {
    MDC.remove("task_id");
    MDC.remove("file_id");
  }

  /** Clear event-specific fields from MDC. */
  private void clearEventFields() {
    MDC.remove("event_type");
    MDC.remove("chunk_index");
    MDC.remove("batch_index");
    MDC.remove("start");
    MDC.remove("end");
    MDC.remove("segments");
    MDC.remove("transcribeMs");
    MDC.remove("attempt");
    MDC.remove("maxRetries");
    MDC.remove("delayMs");
    MDC.remove("errorType");
    MDC.remove("fromStatus");
    MDC.remove("toStatus");
    MDC.remove("chunksProcessed");
    MDC.remove("totalChunks");
    MDC.remove("percentComplete");
    MDC.remove("phase");
  }
}
