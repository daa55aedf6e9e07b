package com.scholary.transcriber.transcription;

import java.util.List;

/**
 * Result of transcribing one piece of audio.
 *
 * @param text full text
 * @param language detected or requested language
 * @param duration audio duration in seconds, 0 when unknown
 * @param segments time-aligned segments in order
 */
public record TranscriptionResult(
    String text, String language, double duration, List<TranscriptionSegment> segments) {

  public TranscriptionResult {
    segments = segments == null ? List.of() : List.copyOf(segments);
  }
}
