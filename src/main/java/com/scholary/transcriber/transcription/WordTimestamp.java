package com.scholary.transcriber.transcription;

/** A recognised word with its time span in seconds. */
public record WordTimestamp(String word, double start, double end) {

  WordTimestamp shifted(double offset) {
    return new WordTimestamp(word, start + offset, end + offset);
  }
}
