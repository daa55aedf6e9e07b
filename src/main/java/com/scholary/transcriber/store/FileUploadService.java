package com.scholary.transcriber.store;

import com.scholary.transcriber.audio.AudioProcessingException;
import com.scholary.transcriber.audio.AudioSegmenter;
import com.scholary.transcriber.config.FileStoreProperties;
import java.io.ByteArrayOutputStream;
import java.time.Instant;
import java.util.Arrays;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Stores uploaded audio and reads it back for processing.
 *
 * <p>Large files are split into fixed-size storage chunks so no single stored object exceeds the
 * chunk size. Storage chunks are a storage concern only and unrelated to the time-windowed audio
 * chunks produced for transcription.
 */
@Service
public class FileUploadService {

  private static final Logger LOGGER = LoggerFactory.getLogger(FileUploadService.class);

  private final TranscriptStore store;
  private final AudioSegmenter segmenter;
  private final long chunkThresholdBytes;
  private final int chunkSizeBytes;

  public FileUploadService(
      TranscriptStore store, AudioSegmenter segmenter, FileStoreProperties properties) {
    this.store = store;
    this.segmenter = segmenter;
    this.chunkThresholdBytes = properties.storageChunkThresholdBytes();
    this.chunkSizeBytes = properties.storageChunkSizeBytes();
  }

  /**
   * Store an uploaded file.
   *
   * <p>The duration is probed from the audio header when possible; files that cannot be probed are
   * still stored and fail later, when they are transcribed.
   *
   * @return the stored record
   */
  public FileRecord upload(String name, String contentType, byte[] data, long lastModified) {
    Double duration = probeDuration(name, data);
    boolean chunked = data.length > chunkThresholdBytes;
    int chunkCount = chunked ? (int) ((data.length + (long) chunkSizeBytes - 1) / chunkSizeBytes) : 0;

    FileRecord record =
        new FileRecord(
            null,
            name,
            contentType,
            data.length,
            lastModified,
            duration,
            chunked ? null : data,
            chunked,
            chunkCount,
            Instant.now());
    String fileId = store.addFile(record);

    if (chunked) {
      for (int i = 0; i < chunkCount; i++) {
        int from = i * chunkSizeBytes;
        int to = Math.min(from + chunkSizeBytes, data.length);
        store.putChunk(fileId, i, Arrays.copyOfRange(data, from, to));
      }
      LOGGER.info(
          "Stored file {} ({} bytes) as {} storage chunks", fileId, data.length, chunkCount);
    } else {
      LOGGER.info("Stored file {} ({} bytes)", fileId, data.length);
    }
    return store.getFile(fileId).orElseThrow();
  }

  /**
   * Read the full audio of a stored file.
   *
   * @throws IllegalStateException if storage chunks are missing
   */
  public byte[] loadAudio(FileRecord file) {
    if (!file.chunked()) {
      return file.data();
    }

    List<byte[]> pieces = store.getChunks(file.id());
    if (pieces.size() != file.chunkCount()) {
      throw new IllegalStateException(
          String.format(
              "File %s has %d of %d storage chunks", file.id(), pieces.size(), file.chunkCount()));
    }

    ByteArrayOutputStream out = new ByteArrayOutputStream((int) file.size());
    for (byte[] piece : pieces) {
      out.writeBytes(piece);
    }
    LOGGER.debug("Reassembled file {} from {} storage chunks", file.id(), pieces.size());
    return out.toByteArray();
  }

  private Double probeDuration(String name, byte[] data) {
    try {
      return segmenter.probeDuration(data, name);
    } catch (AudioProcessingException e) {
      LOGGER.warn("Could not read duration of {}: {}", name, e.getMessage());
      return null;
    }
  }
}
