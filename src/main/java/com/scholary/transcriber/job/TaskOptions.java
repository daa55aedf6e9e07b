package com.scholary.transcriber.job;

import com.scholary.transcriber.transcription.TranscriptionOptions;

/**
 * Per-task processing options.
 *
 * @param language ISO-639-1 hint, or null for auto-detection
 * @param model provider model, or null for the configured default
 * @param temperature sampling temperature
 * @param prompt optional context prompt
 * @param priority queue tier, NORMAL when null
 * @param chunkSeconds window length for chunked files, the default when null
 * @param overlapSeconds overlap between windows, the default when null
 */
public record TaskOptions(
    String language,
    String model,
    double temperature,
    String prompt,
    TaskPriority priority,
    Double chunkSeconds,
    Double overlapSeconds) {

  public TaskOptions {
    if (priority == null) {
      priority = TaskPriority.NORMAL;
    }
  }

  public static TaskOptions defaults() {
    return new TaskOptions(null, null, 0.0, null, TaskPriority.NORMAL, null, null);
  }

  public double chunkSecondsOr(double fallback) {
    return chunkSeconds != null ? chunkSeconds : fallback;
  }

  public double overlapSecondsOr(double fallback) {
    return overlapSeconds != null ? overlapSeconds : fallback;
  }

  public TranscriptionOptions toTranscriptionOptions() {
    return new TranscriptionOptions(language, model, temperature, prompt, null);
  }
}
