package com.scholary.transcriber.audio;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.util.Objects;

/**
 * Encodes float PCM into 16-bit little-endian WAV.
 *
 * <p>The output is a canonical 44-byte RIFF header followed by interleaved samples, which every
 * decoder (including {@code javax.sound.sampled}) reads without extra codecs.
 */
public final class WavEncoder {

  static final int HEADER_SIZE = 44;
  private static final int BITS_PER_SAMPLE = 16;

  private WavEncoder() {}

  /** Encode all frames of the given audio. */
  public static byte[] encode(DecodedAudio audio) {
    return encode(audio, 0, audio.frameCount());
  }

  /**
   * Encode frames {@code [fromFrame, toFrame)} of every channel.
   *
   * @param audio the source audio
   * @param fromFrame first frame, inclusive
   * @param toFrame last frame, exclusive
   * @return WAV bytes
   */
  public static byte[] encode(DecodedAudio audio, int fromFrame, int toFrame) {
    Objects.requireNonNull(audio, "audio must not be null");
    if (fromFrame < 0 || toFrame > audio.frameCount() || fromFrame > toFrame) {
      throw new IllegalArgumentException(
          String.format(
              "Invalid frame range [%d, %d) for %d frames", fromFrame, toFrame, audio.frameCount()));
    }

    int channels = audio.channels();
    int frames = toFrame - fromFrame;
    int blockAlign = channels * BITS_PER_SAMPLE / 8;
    int dataSize = frames * blockAlign;

    ByteArrayOutputStream out = new ByteArrayOutputStream(HEADER_SIZE + dataSize);
    try {
      out.write(new byte[] {'R', 'I', 'F', 'F'});
      writeLEInt(out, 36 + dataSize);
      out.write(new byte[] {'W', 'A', 'V', 'E'});

      out.write(new byte[] {'f', 'm', 't', ' '});
      writeLEInt(out, 16);
      writeLEShort(out, 1); // PCM
      writeLEShort(out, channels);
      writeLEInt(out, audio.sampleRate());
      writeLEInt(out, audio.sampleRate() * blockAlign);
      writeLEShort(out, blockAlign);
      writeLEShort(out, BITS_PER_SAMPLE);

      out.write(new byte[] {'d', 'a', 't', 'a'});
      writeLEInt(out, dataSize);
    } catch (IOException e) {
      throw new UncheckedIOException("Failed to write WAV header", e);
    }

    float[][] samples = audio.samples();
    for (int frame = fromFrame; frame < toFrame; frame++) {
      for (int channel = 0; channel < channels; channel++) {
        float clamped = Math.max(-1f, Math.min(1f, samples[channel][frame]));
        int value = clamped < 0 ? Math.round(clamped * 0x8000) : Math.round(clamped * 0x7FFF);
        out.write(value & 0xFF);
        out.write((value >>> 8) & 0xFF);
      }
    }
    return out.toByteArray();
  }

  private static void writeLEShort(ByteArrayOutputStream out, int v) {
    out.write(v & 0xFF);
    out.write((v >>> 8) & 0xFF);
  }

  private static void writeLEInt(ByteArrayOutputStream out, int v) {
    out.write(v & 0xFF);
    out.write((v >>> 8) & 0xFF);
    out.write((v >>> 16) & 0xFF);
    out.write((v >>> 24) & 0xFF);
  }
}
