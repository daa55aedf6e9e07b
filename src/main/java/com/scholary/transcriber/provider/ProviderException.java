package com.scholary.transcriber.provider;

import com.scholary.transcriber.error.ErrorKind;
import com.scholary.transcriber.error.TranscriberException;

/**
 * Classified failure of a provider call.
 *
 * <p>{@code statusCode} is the HTTP status when the provider answered, 0 otherwise.
 */
public class ProviderException extends TranscriberException {

  private final int statusCode;

  public ProviderException(ErrorKind kind, String message) {
    this(kind, message, 0, 0, null);
  }

  public ProviderException(ErrorKind kind, String message, Throwable cause) {
    this(kind, message, 0, 0, cause);
  }

  public ProviderException(
      ErrorKind kind, String message, int statusCode, long retryAfterMs, Throwable cause) {
    super(kind, message, cause, retryAfterMs);
    this.statusCode = statusCode;
  }

  public int getStatusCode() {
    return statusCode;
  }
}
