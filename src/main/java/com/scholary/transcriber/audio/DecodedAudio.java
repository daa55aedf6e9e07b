package com.scholary.transcriber.audio;

/**
 * Decoded PCM audio held as normalized floats in the range [-1, 1].
 *
 * <p>Samples are indexed {@code [channel][frame]}. Every channel has the same number of frames.
 */
public record DecodedAudio(float[][] samples, int sampleRate) {

  public DecodedAudio {
    if (samples == null || samples.length == 0) {
      throw new IllegalArgumentException("Decoded audio must have at least one channel");
    }
    if (sampleRate <= 0) {
      throw new IllegalArgumentException("Sample rate must be positive: " + sampleRate);
    }
  }

  public int channels() {
    return samples.length;
  }

  public int frameCount() {
    return samples[0].length;
  }

  /** Duration in seconds. */
  public double duration() {
    return (double) frameCount() / sampleRate;
  }
}
