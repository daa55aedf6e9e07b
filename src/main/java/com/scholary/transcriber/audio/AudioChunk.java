package com.scholary.transcriber.audio;

/**
 * One time window of a source recording, encoded as a standalone WAV payload.
 *
 * <p>Times are in seconds relative to the start of the source file. Consecutive chunks overlap by
 * the overlap configured when slicing, so {@code next.startTime() < previous.endTime()} except for
 * the last pair when the overlap is zero.
 *
 * @param data WAV bytes that decode on their own
 * @param startTime window start in seconds
 * @param endTime window end in seconds
 * @param duration {@code endTime - startTime}
 * @param index zero-based position in the slice
 */
public record AudioChunk(byte[] data, double startTime, double endTime, double duration, int index) {

  @Override
  public String toString() {
    return String.format(
        "AudioChunk[index=%d, range=[%.2f-%.2f], bytes=%d]",
        index, startTime, endTime, data == null ? 0 : data.length);
  }
}
