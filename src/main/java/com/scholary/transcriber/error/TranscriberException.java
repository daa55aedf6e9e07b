package com.scholary.transcriber.error;

/**
 * Base exception for every classified pipeline failure.
 *
 * <p>The {@link ErrorKind} is attached where the failure is detected, so callers decide on retries
 * by looking at {@link #isRetryable()} instead of inspecting messages. A failure may also suggest
 * how long to wait before the next attempt; 0 means no suggestion.
 */
public class TranscriberException extends RuntimeException {

  private final ErrorKind kind;
  private final long retryAfterMs;

  public TranscriberException(ErrorKind kind, String message) {
    this(kind, message, null, 0);
  }

  public TranscriberException(ErrorKind kind, String message, Throwable cause) {
    this(kind, message, cause, 0);
  }

  public TranscriberException(ErrorKind kind, String message, Throwable cause, long retryAfterMs) {
    super(message, cause);
    this.kind = kind;
    this.retryAfterMs = retryAfterMs;
  }

  public ErrorKind getKind() {
    return kind;
  }

  public boolean isRetryable() {
    return kind.isRetryable();
  }

  public String getHint() {
    return kind.hint();
  }

  public long getRetryAfterMs() {
    return retryAfterMs;
  }
}
