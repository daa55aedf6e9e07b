package com.scholary.transcriber.store;

import com.scholary.transcriber.transcription.WordTimestamp;
import java.util.List;

/** A persisted transcript segment. {@code id} is assigned by the store. */
public record StoredSegment(
    Long id,
    String transcriptId,
    double start,
    double end,
    String text,
    List<WordTimestamp> wordTimestamps,
    double confidence) {

  public StoredSegment withId(Long newId) {
    return new StoredSegment(newId, transcriptId, start, end, text, wordTimestamps, confidence);
  }
}
