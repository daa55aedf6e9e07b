package com.scholary.transcriber.api;

import java.time.Instant;

/**
 * Error body returned by every endpoint.
 *
 * @param errorCode stable machine-readable code
 * @param message what went wrong
 * @param hint what the caller can do about it, may be null
 */
public record ApiError(String errorCode, String message, String hint, Instant timestamp) {

  static ApiError of(String errorCode, String message, String hint) {
    return new ApiError(errorCode, message, hint, Instant.now());
  }
}
