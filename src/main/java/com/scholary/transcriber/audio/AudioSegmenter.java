package com.scholary.transcriber.audio;

import com.scholary.transcriber.error.ErrorKind;
import java.io.BufferedInputStream;
import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.util.ArrayList;
import java.util.List;
import javax.sound.sampled.AudioFileFormat;
import javax.sound.sampled.AudioFormat;
import javax.sound.sampled.AudioInputStream;
import javax.sound.sampled.AudioSystem;
import javax.sound.sampled.UnsupportedAudioFileException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

/**
 * Splits a recording into overlapping, independently playable WAV chunks.
 *
 * <p>The walk starts at {@code startTime}; each chunk ends at {@code min(cursor + chunkSeconds,
 * end)} and the next one starts {@code overlapSeconds} before that. For a 125 s file with 45 s
 * chunks and 5 s overlap this yields {@code [0,45) [40,85) [80,125)}.
 *
 * <p>Why overlap at all? Words that straddle a boundary would otherwise be cut in half and
 * mis-recognised. The overlapping region is transcribed twice and de-duplicated when segments are
 * merged.
 *
 * <p>The number of chunks per call is capped. Hitting the cap is logged as a warning and the
 * chunks produced so far are returned; the tail of the requested range is left out.
 */
@Component
public class AudioSegmenter {

  private static final Logger LOGGER = LoggerFactory.getLogger(AudioSegmenter.class);

  public static final double DEFAULT_CHUNK_SECONDS = 45.0;
  public static final double DEFAULT_OVERLAP_SECONDS = 0.2;
  public static final int DEFAULT_MAX_CHUNKS = 100;
  public static final long DEFAULT_MAX_FILE_SIZE_BYTES = 500L * 1024 * 1024;

  private final int maxChunks;
  private final long maxFileSizeBytes;

  @Autowired
  public AudioSegmenter(
      @Value("${transcription.chunking.max-chunks:100}") int maxChunks,
      @Value("${transcription.chunking.max-file-size-bytes:524288000}") long maxFileSizeBytes) {
    if (maxChunks <= 0) {
      throw new IllegalArgumentException("maxChunks must be positive: " + maxChunks);
    }
    this.maxChunks = maxChunks;
    this.maxFileSizeBytes = maxFileSizeBytes;
  }

  public AudioSegmenter() {
    this(DEFAULT_MAX_CHUNKS, DEFAULT_MAX_FILE_SIZE_BYTES);
  }

  /**
   * Slice the given range of a recording into overlapping chunks.
   *
   * @param audio encoded source bytes
   * @param fileId identity of the source, used in errors and logs
   * @param startTime first second to include, must be non-negative
   * @param endTime last second to include; clamped to the decoded duration
   * @param chunkSeconds length of each window
   * @param overlapSeconds overlap between consecutive windows, smaller than the window
   * @return the chunks in time order, never empty
   * @throws IllegalArgumentException if the parameters are inconsistent
   * @throws AudioProcessingException if the audio is too large or cannot be decoded
   */
  public List<AudioChunk> slice(
      byte[] audio,
      String fileId,
      double startTime,
      double endTime,
      double chunkSeconds,
      double overlapSeconds) {
    validateRange(startTime, endTime, chunkSeconds, overlapSeconds);

    DecodedAudio decoded = decode(audio, fileId);
    double effectiveEnd = Math.min(endTime, decoded.duration());
    if (startTime >= effectiveEnd) {
      throw new IllegalArgumentException(
          String.format(
              "Start time %.2fs is at or past the end of the audio (%.2fs) for file %s",
              startTime, decoded.duration(), fileId));
    }

    LOGGER.info(
        "Slicing audio: fileId={}, range=[{}-{}], chunk={}s, overlap={}s",
        fileId,
        startTime,
        effectiveEnd,
        chunkSeconds,
        overlapSeconds);

    List<AudioChunk> chunks = new ArrayList<>();
    double cursor = startTime;
    int index = 0;

    while (cursor < effectiveEnd && index < maxChunks) {
      double chunkEnd = Math.min(cursor + chunkSeconds, effectiveEnd);
      int fromFrame = toFrame(cursor, decoded);
      int toFrame = toFrame(chunkEnd, decoded);

      byte[] data;
      try {
        data = WavEncoder.encode(decoded, fromFrame, toFrame);
      } catch (RuntimeException e) {
        throw new AudioProcessingException(
            ErrorKind.DECODE_FAILED,
            fileId,
            String.format("Failed to encode chunk %d of file %s", index, fileId),
            e);
      }

      chunks.add(new AudioChunk(data, cursor, chunkEnd, chunkEnd - cursor, index));
      LOGGER.debug("Chunk sliced: index={}, range=[{}-{}]", index, cursor, chunkEnd);
      index++;

      if (chunkEnd >= effectiveEnd) {
        break;
      }
      cursor = chunkEnd - overlapSeconds;
    }

    if (index >= maxChunks && chunks.get(chunks.size() - 1).endTime() < effectiveEnd) {
      LOGGER.warn(
          "Chunk limit reached for file {}: produced {} chunks, audio after {}s was not sliced",
          fileId,
          maxChunks,
          chunks.get(chunks.size() - 1).endTime());
    }

    LOGGER.info("Sliced file {} into {} chunks", fileId, chunks.size());
    return chunks;
  }

  /** Slice the whole recording with the default window and overlap. */
  public List<AudioChunk> slice(byte[] audio, String fileId) {
    return slice(
        audio,
        fileId,
        0,
        Double.MAX_VALUE,
        DEFAULT_CHUNK_SECONDS,
        DEFAULT_OVERLAP_SECONDS);
  }

  /**
   * Concatenate chunks back into one mono recording.
   *
   * <p>The first chunk's sample rate wins. Chunks recorded at another rate are resampled with
   * linear interpolation before they are appended. Only the first channel of each chunk is used.
   *
   * @param chunks chunks in playback order
   * @return WAV bytes
   */
  public byte[] merge(List<AudioChunk> chunks) {
    if (chunks == null || chunks.isEmpty()) {
      throw new IllegalArgumentException("No chunks to merge");
    }

    List<float[]> parts = new ArrayList<>(chunks.size());
    int targetRate = -1;
    int totalFrames = 0;

    for (AudioChunk chunk : chunks) {
      DecodedAudio decoded = decode(chunk.data(), "chunk-" + chunk.index());
      if (targetRate < 0) {
        targetRate = decoded.sampleRate();
      }
      float[] mono = decoded.samples()[0];
      if (decoded.sampleRate() != targetRate) {
        LOGGER.debug(
            "Resampling chunk {} from {}Hz to {}Hz", chunk.index(), decoded.sampleRate(), targetRate);
        mono = resample(mono, decoded.sampleRate(), targetRate);
      }
      parts.add(mono);
      totalFrames += mono.length;
    }

    float[] merged = new float[totalFrames];
    int offset = 0;
    for (float[] part : parts) {
      System.arraycopy(part, 0, merged, offset, part.length);
      offset += part.length;
    }

    LOGGER.info("Merged {} chunks into {} frames at {}Hz", chunks.size(), totalFrames, targetRate);
    return WavEncoder.encode(new DecodedAudio(new float[][] {merged}, targetRate));
  }

  /**
   * Decode audio into float PCM.
   *
   * <p>WAV, AIFF and AU are read by the JDK. MP3 goes through the MPEG reader registered on the
   * classpath, which decodes to PCM first; that output is then converted like any other PCM input.
   *
   * <p>The decoding streams are opened per call and closed on every path.
   *
   * @throws AudioProcessingException with {@link ErrorKind#RESOURCE_LIMIT_EXCEEDED} when the input
   *     is over the size ceiling, or {@link ErrorKind#DECODE_FAILED} when it cannot be decoded
   */
  public DecodedAudio decode(byte[] audio, String fileId) {
    checkSize(audio, fileId);

    try (AudioInputStream source = openStream(audio);
        AudioInputStream pcm = toPcm(source)) {
      AudioFormat pcmFormat = pcm.getFormat();
      int channels = pcmFormat.getChannels();
      float sampleRate = pcmFormat.getSampleRate();
      if (channels <= 0 || sampleRate <= 0) {
        throw new AudioProcessingException(
            ErrorKind.DECODE_FAILED,
            fileId,
            String.format("Unsupported audio format for file %s: %s", fileId, pcmFormat));
      }

      AudioFormat pcm16 =
          new AudioFormat(
              AudioFormat.Encoding.PCM_SIGNED, sampleRate, 16, channels, channels * 2, sampleRate, false);

      try (AudioInputStream converted = AudioSystem.getAudioInputStream(pcm16, pcm)) {
        byte[] raw = converted.readAllBytes();
        return toFloat(raw, channels, Math.round(sampleRate));
      }
    } catch (AudioProcessingException e) {
      throw e;
    } catch (UnsupportedAudioFileException | RuntimeException e) {
      // The MPEG reader reports malformed frames unchecked
      throw new AudioProcessingException(
          ErrorKind.DECODE_FAILED,
          fileId,
          String.format("Failed to decode audio for file %s: %s", fileId, e.getMessage()),
          e);
    } catch (IOException e) {
      throw new AudioProcessingException(
          ErrorKind.DECODE_FAILED,
          fileId,
          String.format("I/O error decoding audio for file %s", fileId),
          e);
    }
  }

  /**
   * Read the duration of a recording.
   *
   * <p>Uses the container header when it declares a frame count or a {@code duration} property
   * (microseconds, set by the MPEG reader), otherwise decodes the audio.
   */
  public double probeDuration(byte[] audio, String fileId) {
    checkSize(audio, fileId);
    try (BufferedInputStream in = new BufferedInputStream(new ByteArrayInputStream(audio))) {
      AudioFileFormat fileFormat = AudioSystem.getAudioFileFormat(in);
      Object micros = fileFormat.properties().get("duration");
      if (micros instanceof Long && (Long) micros > 0) {
        return (Long) micros / 1_000_000.0;
      }
      long frames = fileFormat.getFrameLength();
      float frameRate = fileFormat.getFormat().getFrameRate();
      if (frames != AudioSystem.NOT_SPECIFIED && frameRate > 0) {
        return frames / frameRate;
      }
    } catch (UnsupportedAudioFileException | IOException | RuntimeException e) {
      throw new AudioProcessingException(
          ErrorKind.DECODE_FAILED,
          fileId,
          String.format("Failed to read audio header for file %s", fileId),
          e);
    }
    return decode(audio, fileId).duration();
  }

  /**
   * Linear-interpolation resampler.
   *
   * <p>Output length is {@code floor(input.length / (inRate / outRate))}.
   */
  static float[] resample(float[] input, int inRate, int outRate) {
    if (inRate == outRate || input.length == 0) {
      return input;
    }
    double ratio = (double) inRate / outRate;
    int outLength = (int) Math.floor(input.length / ratio);
    float[] output = new float[outLength];
    for (int i = 0; i < outLength; i++) {
      double position = i * ratio;
      int index = (int) Math.floor(position);
      double fraction = position - index;
      float current = input[Math.min(index, input.length - 1)];
      float next = input[Math.min(index + 1, input.length - 1)];
      output[i] = (float) (current * (1 - fraction) + next * fraction);
    }
    return output;
  }

  private void checkSize(byte[] audio, String fileId) {
    if (audio == null || audio.length == 0) {
      throw new AudioProcessingException(
          ErrorKind.DECODE_FAILED, fileId, String.format("Audio for file %s is empty", fileId));
    }
    if (audio.length > maxFileSizeBytes) {
      throw new AudioProcessingException(
          ErrorKind.RESOURCE_LIMIT_EXCEEDED,
          fileId,
          String.format(
              "Audio for file %s is %d bytes, limit is %d bytes",
              fileId, audio.length, maxFileSizeBytes));
    }
  }

  private static void validateRange(
      double startTime, double endTime, double chunkSeconds, double overlapSeconds) {
    if (startTime < 0) {
      throw new IllegalArgumentException("Start time must be non-negative: " + startTime);
    }
    if (startTime >= endTime) {
      throw new IllegalArgumentException(
          String.format("Start time %.2f must be before end time %.2f", startTime, endTime));
    }
    if (chunkSeconds <= 0) {
      throw new IllegalArgumentException("Chunk length must be positive: " + chunkSeconds);
    }
    if (overlapSeconds < 0 || overlapSeconds >= chunkSeconds) {
      throw new IllegalArgumentException(
          String.format(
              "Overlap %.2f must be in [0, %.2f)", overlapSeconds, chunkSeconds));
    }
  }

  private static AudioInputStream openStream(byte[] audio)
      throws UnsupportedAudioFileException, IOException {
    return AudioSystem.getAudioInputStream(
        new BufferedInputStream(new ByteArrayInputStream(audio)));
  }

  private static AudioInputStream toPcm(AudioInputStream source) {
    AudioFormat.Encoding encoding = source.getFormat().getEncoding();
    if (AudioFormat.Encoding.PCM_SIGNED.equals(encoding)
        || AudioFormat.Encoding.PCM_UNSIGNED.equals(encoding)) {
      return source;
    }
    return AudioSystem.getAudioInputStream(AudioFormat.Encoding.PCM_SIGNED, source);
  }

  private static int toFrame(double seconds, DecodedAudio audio) {
    long frame = Math.round(seconds * audio.sampleRate());
    return (int) Math.max(0, Math.min(frame, audio.frameCount()));
  }

  private static DecodedAudio toFloat(byte[] raw, int channels, int sampleRate) {
    int frames = raw.length / (channels * 2);
    float[][] samples = new float[channels][frames];
    int offset = 0;
    for (int frame = 0; frame < frames; frame++) {
      for (int channel = 0; channel < channels; channel++) {
        short value = (short) ((raw[offset] & 0xFF) | (raw[offset + 1] << 8));
        samples[channel][frame] = value / 32768f;
        offset += 2;
      }
    }
    return new DecodedAudio(samples, sampleRate);
  }
}
