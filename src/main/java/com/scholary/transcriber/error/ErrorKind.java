package com.scholary.transcriber.error;

/**
 * Fixed taxonomy of failures the pipeline can report.
 *
 * <p>Each kind knows whether retrying can help and carries a remediation hint that is shown to the
 * user alongside the diagnostic message. The hint never contains the diagnostic detail itself.
 */
public enum ErrorKind {
  DECODE_FAILED(false, "The file could not be decoded. Convert it to WAV or MP3 and upload again."),
  RESOURCE_LIMIT_EXCEEDED(false, "The file is larger than the processing limit. Split it into smaller files."),
  AUTHENTICATION(false, "Check that the transcription API key is configured and still valid."),
  RATE_LIMIT(true, "The provider is rate limiting requests. Wait a moment before trying again."),
  TIMEOUT(true, "The request took too long. Try again or use a shorter file."),
  FILE_TOO_LARGE(false, "The audio exceeds the provider upload limit. Compress or split the file."),
  INVALID_FORMAT(false, "The audio format is not supported. Use WAV, MP3, M4A, FLAC or OGG."),
  QUOTA_EXCEEDED(false, "The provider quota is exhausted. Check the account balance or plan."),
  NETWORK(true, "The provider could not be reached. Check the network connection and retry."),
  TRANSCRIPTION_FAILED(true, "Transcription failed. Try again later.");

  private final boolean retryable;
  private final String hint;

  ErrorKind(boolean retryable, String hint) {
    this.retryable = retryable;
    this.hint = hint;
  }

  public boolean isRetryable() {
    return retryable;
  }

  public String hint() {
    return hint;
  }
}
