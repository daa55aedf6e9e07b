package com.scholary.transcriber.api;

import com.scholary.transcriber.error.ErrorKind;
import com.scholary.transcriber.error.TranscriberException;
import com.scholary.transcriber.job.TaskNotFoundException;
import com.scholary.transcriber.job.TaskStateException;
import com.scholary.transcriber.objectstore.ObjectStoreException;
import java.util.EnumMap;
import java.util.Map;
import java.util.stream.Collectors;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.HttpStatusCode;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.MissingServletRequestParameterException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.multipart.MaxUploadSizeExceededException;
import org.springframework.web.multipart.support.MissingServletRequestPartException;
import org.springframework.web.server.ResponseStatusException;

/**
 * Maps exceptions to {@link ApiError} bodies.
 *
 * <p>Pipeline failures keep their {@link ErrorKind} as error code and carry its remediation hint.
 */
@RestControllerAdvice
public class GlobalExceptionHandler {

  private static final Logger LOGGER = LoggerFactory.getLogger(GlobalExceptionHandler.class);

  private static final Map<ErrorKind, HttpStatus> STATUS_BY_KIND = new EnumMap<>(ErrorKind.class);

  static {
    STATUS_BY_KIND.put(ErrorKind.DECODE_FAILED, HttpStatus.UNPROCESSABLE_ENTITY);
    STATUS_BY_KIND.put(ErrorKind.RESOURCE_LIMIT_EXCEEDED, HttpStatus.PAYLOAD_TOO_LARGE);
    // The credential is ours, not the caller's
    STATUS_BY_KIND.put(ErrorKind.AUTHENTICATION, HttpStatus.BAD_GATEWAY);
    STATUS_BY_KIND.put(ErrorKind.RATE_LIMIT, HttpStatus.TOO_MANY_REQUESTS);
    STATUS_BY_KIND.put(ErrorKind.TIMEOUT, HttpStatus.GATEWAY_TIMEOUT);
    STATUS_BY_KIND.put(ErrorKind.FILE_TOO_LARGE, HttpStatus.PAYLOAD_TOO_LARGE);
    STATUS_BY_KIND.put(ErrorKind.INVALID_FORMAT, HttpStatus.UNSUPPORTED_MEDIA_TYPE);
    STATUS_BY_KIND.put(ErrorKind.QUOTA_EXCEEDED, HttpStatus.BAD_GATEWAY);
    STATUS_BY_KIND.put(ErrorKind.NETWORK, HttpStatus.BAD_GATEWAY);
    STATUS_BY_KIND.put(ErrorKind.TRANSCRIPTION_FAILED, HttpStatus.BAD_GATEWAY);
  }

  @ExceptionHandler(TranscriberException.class)
  public ResponseEntity<ApiError> handleTranscriber(TranscriberException ex) {
    HttpStatus status = STATUS_BY_KIND.getOrDefault(ex.getKind(), HttpStatus.INTERNAL_SERVER_ERROR);
    LOGGER.warn("Request failed: kind={}, status={}, message={}", ex.getKind(), status, ex.getMessage());
    return ResponseEntity.status(status)
        .body(ApiError.of(ex.getKind().name(), ex.getMessage(), ex.getHint()));
  }

  @ExceptionHandler(TaskNotFoundException.class)
  public ResponseEntity<ApiError> handleTaskNotFound(TaskNotFoundException ex) {
    return ResponseEntity.status(HttpStatus.NOT_FOUND)
        .body(ApiError.of("TASK_NOT_FOUND", ex.getMessage(), null));
  }

  @ExceptionHandler(TaskStateException.class)
  public ResponseEntity<ApiError> handleTaskState(TaskStateException ex) {
    return ResponseEntity.status(HttpStatus.CONFLICT)
        .body(
            ApiError.of(
                "INVALID_TASK_STATE",
                ex.getMessage(),
                "Check the task status before changing it."));
  }

  @ExceptionHandler(ResponseStatusException.class)
  public ResponseEntity<ApiError> handleResponseStatus(ResponseStatusException ex) {
    HttpStatusCode status = ex.getStatusCode();
    String code = status.value() == 404 ? "NOT_FOUND" : "REQUEST_FAILED";
    return ResponseEntity.status(status).body(ApiError.of(code, ex.getReason(), null));
  }

  @ExceptionHandler(MethodArgumentNotValidException.class)
  public ResponseEntity<ApiError> handleValidation(MethodArgumentNotValidException ex) {
    String message =
        ex.getBindingResult().getFieldErrors().stream()
            .map(error -> error.getField() + " " + error.getDefaultMessage())
            .collect(Collectors.joining(", "));
    return ResponseEntity.badRequest().body(ApiError.of("VALIDATION_FAILED", message, null));
  }

  @ExceptionHandler({
    IllegalArgumentException.class,
    MissingServletRequestParameterException.class,
    MissingServletRequestPartException.class
  })
  public ResponseEntity<ApiError> handleBadRequest(Exception ex) {
    return ResponseEntity.badRequest().body(ApiError.of("BAD_REQUEST", ex.getMessage(), null));
  }

  @ExceptionHandler(MaxUploadSizeExceededException.class)
  public ResponseEntity<ApiError> handleUploadSize(MaxUploadSizeExceededException ex) {
    return ResponseEntity.status(HttpStatus.PAYLOAD_TOO_LARGE)
        .body(
            ApiError.of(
                ErrorKind.RESOURCE_LIMIT_EXCEEDED.name(),
                ex.getMessage(),
                ErrorKind.RESOURCE_LIMIT_EXCEEDED.hint()));
  }

  @ExceptionHandler(ObjectStoreException.class)
  public ResponseEntity<ApiError> handleObjectStore(ObjectStoreException ex) {
    LOGGER.error("Object storage failure", ex);
    return ResponseEntity.status(HttpStatus.SERVICE_UNAVAILABLE)
        .body(ApiError.of("STORAGE_UNAVAILABLE", ex.getMessage(), "Try again later."));
  }

  @ExceptionHandler(Exception.class)
  public ResponseEntity<ApiError> handleUnexpected(Exception ex) {
    LOGGER.error("Unexpected error", ex);
    return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR)
        .body(ApiError.of("INTERNAL_ERROR", "An unexpected error occurred", null));
  }
}
