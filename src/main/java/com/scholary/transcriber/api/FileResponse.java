package com.scholary.transcriber.api;

import com.scholary.transcriber.store.FileRecord;
import java.time.Instant;

/** Stored file, without its bytes. */
public record FileResponse(
    String fileId,
    String name,
    String contentType,
    long size,
    Double duration,
    boolean chunked,
    int storageChunks,
    Instant uploadedAt) {

  static FileResponse from(FileRecord file) {
    return new FileResponse(
        file.id(),
        file.name(),
        file.contentType(),
        file.size(),
        file.duration(),
        file.chunked(),
        file.chunkCount(),
        file.uploadedAt());
  }
}
