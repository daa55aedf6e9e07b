package com.scholary.transcriber.audio;

/** Builds small WAV recordings for tests. */
public final class TestAudio {

  private TestAudio() {}

  /** A 440 Hz tone. */
  public static byte[] tone(double seconds, int sampleRate, int channels) {
    int frames = (int) Math.round(seconds * sampleRate);
    float[][] samples = new float[channels][frames];
    for (int c = 0; c < channels; c++) {
      for (int i = 0; i < frames; i++) {
        samples[c][i] = (float) (0.5 * Math.sin(2 * Math.PI * 440 * i / sampleRate));
      }
    }
    return WavEncoder.encode(new DecodedAudio(samples, sampleRate));
  }

  public static byte[] tone(double seconds) {
    return tone(seconds, 8000, 1);
  }

  /** Samples per MPEG-1 Layer III frame. */
  public static final int MP3_FRAME_SAMPLES = 1152;

  /**
   * Silent MPEG-1 Layer III stream: 128 kbit/s, 44.1 kHz, mono, no CRC.
   *
   * <p>Each frame is a header followed by zeroed side info and main data, which decodes to
   * silence.
   */
  public static byte[] silentMp3(int frames) {
    int frameLength = 144 * 128_000 / 44_100;
    byte[] out = new byte[frames * frameLength];
    for (int f = 0; f < frames; f++) {
      int offset = f * frameLength;
      out[offset] = (byte) 0xFF;
      out[offset + 1] = (byte) 0xFB;
      out[offset + 2] = (byte) 0x90;
      out[offset + 3] = (byte) 0xC4;
    }
    return out;
  }

  public static double mp3Seconds(int frames) {
    return frames * (double) MP3_FRAME_SAMPLES / 44_100;
  }
}
