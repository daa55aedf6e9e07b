package com.scholary.transcriber.store;

/** Persisted status of a transcript. */
public enum TranscriptStatus {
  PENDING,
  PROCESSING,
  COMPLETED,
  FAILED
}
