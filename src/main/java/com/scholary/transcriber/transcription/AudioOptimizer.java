package com.scholary.transcriber.transcription;

import com.scholary.transcriber.audio.AudioProcessingException;
import com.scholary.transcriber.audio.AudioSegmenter;
import com.scholary.transcriber.audio.DecodedAudio;
import com.scholary.transcriber.audio.WavEncoder;
import com.scholary.transcriber.config.TranscriptionProperties;
import com.scholary.transcriber.error.ErrorKind;
import com.scholary.transcriber.error.TranscriberException;
import java.util.Locale;
import java.util.Set;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Prepares audio for upload.
 *
 * <p>Small files in a format the provider handles well are sent as they are. Anything else is
 * decoded, truncated to the maximum duration and re-encoded as WAV. If the audio cannot be decoded
 * locally the original bytes are sent and the provider gets to decide.
 */
@Component
public class AudioOptimizer {

  private static final Logger LOGGER = LoggerFactory.getLogger(AudioOptimizer.class);

  static final Set<String> PREFERRED_TYPES = Set.of("audio/mp3", "audio/mpeg", "audio/wav");

  private final AudioSegmenter segmenter;
  private final long optimalSizeBytes;
  private final int maxDurationSeconds;

  public AudioOptimizer(AudioSegmenter segmenter, TranscriptionProperties properties) {
    this.segmenter = segmenter;
    this.optimalSizeBytes = properties.optimization().optimalSizeBytes();
    this.maxDurationSeconds = properties.optimization().maxDurationSeconds();
  }

  /**
   * Optimize audio for upload.
   *
   * @return the source itself when no work is needed, otherwise a WAV copy
   * @throws TranscriberException with {@link ErrorKind#INVALID_FORMAT} if the decoded audio is
   *     empty, or {@link ErrorKind#RESOURCE_LIMIT_EXCEEDED} if it is too large to decode
   */
  public AudioSource optimize(AudioSource source) {
    if (source.size() <= optimalSizeBytes && isPreferred(source.contentType())) {
      LOGGER.debug("Skipping optimization for {}", source);
      return source;
    }

    DecodedAudio decoded;
    try {
      decoded = segmenter.decode(source.data(), source.filename());
    } catch (AudioProcessingException e) {
      if (e.getKind() == ErrorKind.RESOURCE_LIMIT_EXCEEDED) {
        throw e;
      }
      LOGGER.warn(
          "Could not decode {} locally, sending original bytes: {}", source.filename(), e.getMessage());
      return source;
    }

    long maxFrames = (long) maxDurationSeconds * decoded.sampleRate();
    int frames = (int) Math.min(decoded.frameCount(), maxFrames);
    if (frames == 0) {
      throw new TranscriberException(
          ErrorKind.INVALID_FORMAT, "Audio file " + source.filename() + " contains no samples");
    }
    if (frames < decoded.frameCount()) {
      LOGGER.info(
          "Truncating {} from {}s to {}s", source.filename(), decoded.duration(), maxDurationSeconds);
    }

    byte[] wav = WavEncoder.encode(decoded, 0, frames);
    LOGGER.info(
        "Optimized audio {}: {} bytes -> {} bytes", source.filename(), source.size(), wav.length);
    return source.withData(toWavName(source.filename()), "audio/wav", wav);
  }

  private static boolean isPreferred(String contentType) {
    return contentType != null && PREFERRED_TYPES.contains(contentType.toLowerCase(Locale.ROOT));
  }

  private static String toWavName(String filename) {
    int dot = filename.lastIndexOf('.');
    String base = dot > 0 ? filename.substring(0, dot) : filename;
    return base + ".wav";
  }
}
