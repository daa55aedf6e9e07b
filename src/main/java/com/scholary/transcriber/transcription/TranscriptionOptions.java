package com.scholary.transcriber.transcription;

/**
 * Recognition options.
 *
 * @param language ISO-639-1 hint, or null for auto-detection
 * @param model provider model, or null for the configured default
 * @param temperature sampling temperature
 * @param prompt optional context prompt
 * @param listener optional progress listener, not part of the cache identity
 */
public record TranscriptionOptions(
    String language, String model, double temperature, String prompt, TranscriptionListener listener) {

  public static TranscriptionOptions defaults() {
    return new TranscriptionOptions(null, null, 0.0, null, null);
  }

  public TranscriptionOptions withListener(TranscriptionListener newListener) {
    return new TranscriptionOptions(language, model, temperature, prompt, newListener);
  }

  void report(int percent, String stage) {
    if (listener != null) {
      listener.onProgress(percent, stage);
    }
  }
}
