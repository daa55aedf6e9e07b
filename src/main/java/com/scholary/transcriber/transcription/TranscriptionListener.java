package com.scholary.transcriber.transcription;

/** Receives progress of a single transcription call. */
@FunctionalInterface
public interface TranscriptionListener {

  /**
   * @param percent 0..100, non-decreasing within one call
   * @param stage short label of the current step
   */
  void onProgress(int percent, String stage);
}
