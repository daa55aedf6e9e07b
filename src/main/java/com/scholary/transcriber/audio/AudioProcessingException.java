package com.scholary.transcriber.audio;

import com.scholary.transcriber.error.ErrorKind;
import com.scholary.transcriber.error.TranscriberException;

/**
 * Thrown when audio cannot be decoded, sliced or re-encoded.
 *
 * <p>Carries the identity of the file being processed so the failure can be traced back to the
 * upload.
 */
public class AudioProcessingException extends TranscriberException {

  private final String fileId;

  public AudioProcessingException(ErrorKind kind, String fileId, String message) {
    super(kind, message);
    this.fileId = fileId;
  }

  public AudioProcessingException(ErrorKind kind, String fileId, String message, Throwable cause) {
    super(kind, message, cause);
    this.fileId = fileId;
  }

  public String getFileId() {
    return fileId;
  }
}
