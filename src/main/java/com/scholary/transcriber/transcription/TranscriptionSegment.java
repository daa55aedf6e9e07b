package com.scholary.transcriber.transcription;

import java.util.List;

/**
 * A span of transcribed text.
 *
 * @param id position in the transcript, zero-based
 * @param start start in seconds
 * @param end end in seconds
 * @param text segment text, trimmed
 * @param wordTimestamps word timings when the provider returned them, otherwise empty
 * @param confidence 0..1
 */
public record TranscriptionSegment(
    int id,
    double start,
    double end,
    String text,
    List<WordTimestamp> wordTimestamps,
    double confidence) {

  public TranscriptionSegment {
    wordTimestamps = wordTimestamps == null ? List.of() : List.copyOf(wordTimestamps);
  }

  /** Move the segment by {@code offset} seconds and renumber it. */
  public TranscriptionSegment shifted(double offset, int newId) {
    return new TranscriptionSegment(
        newId,
        start + offset,
        end + offset,
        text,
        wordTimestamps.stream().map(w -> w.shifted(offset)).toList(),
        confidence);
  }
}
