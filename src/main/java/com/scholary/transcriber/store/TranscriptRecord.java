package com.scholary.transcriber.store;

import java.time.Instant;

/** A persisted transcript; its segments are stored separately. */
public record TranscriptRecord(
    String id,
    String fileId,
    TranscriptStatus status,
    String rawText,
    String language,
    long processingTimeMs,
    Instant createdAt,
    Instant updatedAt) {

  public TranscriptRecord withId(String newId) {
    return new TranscriptRecord(
        newId, fileId, status, rawText, language, processingTimeMs, createdAt, updatedAt);
  }

  public TranscriptRecord withStatus(TranscriptStatus newStatus, Instant at) {
    return new TranscriptRecord(id, fileId, newStatus, rawText, language, processingTimeMs, createdAt, at);
  }
}
