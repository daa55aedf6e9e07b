package com.scholary.transcriber.store;

import java.time.Instant;
import java.util.Locale;

/**
 * An uploaded audio file.
 *
 * <p>Small files keep their bytes in {@code data}. Files over the storage threshold are split into
 * storage chunks; then {@code data} is null, {@code chunked} is true and the bytes are read back
 * through {@link TranscriptStore#getChunks}.
 *
 * @param duration seconds, null until probed
 */
public record FileRecord(
    String id,
    String name,
    String contentType,
    long size,
    long lastModified,
    Double duration,
    byte[] data,
    boolean chunked,
    int chunkCount,
    Instant uploadedAt) {

  public FileRecord withId(String newId) {
    return new FileRecord(
        newId, name, contentType, size, lastModified, duration, data, chunked, chunkCount, uploadedAt);
  }

  public FileRecord withDuration(Double newDuration) {
    return new FileRecord(
        id, name, contentType, size, lastModified, newDuration, data, chunked, chunkCount, uploadedAt);
  }

  public String format() {
    int dot = name.lastIndexOf('.');
    return dot >= 0 ? name.substring(dot + 1).toLowerCase(Locale.ROOT) : "";
  }

  @Override
  public String toString() {
    return String.format(
        "FileRecord[id=%s, name=%s, size=%d, chunked=%s, chunks=%d]",
        id, name, size, chunked, chunkCount);
  }
}
