package com.scholary.transcriber.provider;

import com.scholary.transcriber.error.ErrorKind;
import com.scholary.transcriber.error.TranscriberException;
import java.io.IOException;
import java.net.http.HttpTimeoutException;
import java.util.Locale;
import java.util.Optional;

/**
 * Maps provider failures onto {@link ErrorKind}.
 *
 * <p>HTTP answers are classified by status code. Message sniffing is only used for opaque
 * exceptions that carry nothing but text, in this precedence: authentication, rate limit,
 * timeout, size, format, quota.
 */
public final class ErrorClassifier {

  static final long DEFAULT_RATE_LIMIT_BACKOFF_MS = 1000;

  private ErrorClassifier() {}

  /**
   * Classify a non-2xx HTTP answer.
   *
   * @param status HTTP status code
   * @param body response body, used for the diagnostic message and to spot quota errors
   * @param retryAfterHeader value of the Retry-After header, may be empty
   */
  public static ProviderException fromStatus(int status, String body, Optional<String> retryAfterHeader) {
    String detail = String.format("Provider returned status %d: %s", status, abbreviate(body));
    String lowerBody = body == null ? "" : body.toLowerCase(Locale.ROOT);

    if (status == 401 || status == 403) {
      return new ProviderException(ErrorKind.AUTHENTICATION, detail, status, 0, null);
    }
    if (status == 402 || lowerBody.contains("insufficient_quota")) {
      return new ProviderException(ErrorKind.QUOTA_EXCEEDED, detail, status, 0, null);
    }
    if (status == 429) {
      long backoff = retryAfterHeader.map(ErrorClassifier::parseRetryAfter).orElse(DEFAULT_RATE_LIMIT_BACKOFF_MS);
      return new ProviderException(ErrorKind.RATE_LIMIT, detail, status, backoff, null);
    }
    if (status == 408 || status == 504) {
      return new ProviderException(ErrorKind.TIMEOUT, detail, status, 0, null);
    }
    if (status == 413) {
      return new ProviderException(ErrorKind.FILE_TOO_LARGE, detail, status, 0, null);
    }
    if (status == 400 || status == 415 || status == 422) {
      return new ProviderException(ErrorKind.INVALID_FORMAT, detail, status, 0, null);
    }
    return new ProviderException(ErrorKind.TRANSCRIPTION_FAILED, detail, status, 0, null);
  }

  /**
   * Classify an arbitrary failure.
   *
   * <p>Already classified exceptions are returned unchanged.
   */
  public static TranscriberException classify(Throwable error) {
    if (error instanceof TranscriberException) {
      return (TranscriberException) error;
    }
    if (error instanceof HttpTimeoutException) {
      return new ProviderException(ErrorKind.TIMEOUT, "Provider request timed out", error);
    }

    String message = error.getMessage() == null ? "" : error.getMessage();
    String lower = message.toLowerCase(Locale.ROOT);

    if (lower.contains("401") || lower.contains("unauthorized")) {
      return new ProviderException(ErrorKind.AUTHENTICATION, message, error);
    }
    if (lower.contains("429") || lower.contains("rate limit")) {
      return new ProviderException(
          ErrorKind.RATE_LIMIT, message, 429, DEFAULT_RATE_LIMIT_BACKOFF_MS, error);
    }
    if (lower.contains("timeout") || lower.contains("timed out")) {
      return new ProviderException(ErrorKind.TIMEOUT, message, error);
    }
    if (lower.contains("too large") || lower.contains("413")) {
      return new ProviderException(ErrorKind.FILE_TOO_LARGE, message, error);
    }
    if (lower.contains("invalid_request_error") || lower.contains("invalid")) {
      return new ProviderException(ErrorKind.INVALID_FORMAT, message, error);
    }
    if (lower.contains("insufficient") || lower.contains("quota")) {
      return new ProviderException(ErrorKind.QUOTA_EXCEEDED, message, error);
    }
    if (error instanceof IOException) {
      return new ProviderException(
          ErrorKind.NETWORK, "Network error calling provider: " + message, error);
    }
    return new ProviderException(
        ErrorKind.TRANSCRIPTION_FAILED, "Transcription failed: " + message, error);
  }

  /** Retry-After is either delta-seconds or an HTTP date; only the former is honoured. */
  static long parseRetryAfter(String value) {
    try {
      return Math.max(0, Long.parseLong(value.trim())) * 1000;
    } catch (NumberFormatException e) {
      return DEFAULT_RATE_LIMIT_BACKOFF_MS;
    }
  }

  private static String abbreviate(String body) {
    if (body == null) {
      return "";
    }
    return body.length() > 500 ? body.substring(0, 500) + "..." : body;
  }
}
