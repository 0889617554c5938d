package com.scholary.dialect.transcriber.api;

import com.scholary.dialect.transcriber.audio.AudioFormatException;
import com.scholary.dialect.transcriber.audio.EmptyAudioException;
import com.scholary.dialect.transcriber.config.ConfigurationException;
import com.scholary.dialect.transcriber.objectstore.ObjectStoreException;
import java.time.Instant;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.core.task.TaskRejectedException;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

/**
 * Translates pipeline failures into HTTP responses.
 *
 * <p>Unreadable or empty audio is the caller's content problem (422), bad settings are a bad
 * request (400), and object-store failures are an upstream error (502).
 */
@RestControllerAdvice
public class ApiExceptionHandler {

  private static final Logger LOGGER = LoggerFactory.getLogger(ApiExceptionHandler.class);

  @ExceptionHandler({AudioFormatException.class, EmptyAudioException.class})
  public ResponseEntity<ApiError> handleAudio(RuntimeException ex) {
    LOGGER.warn("Rejected audio: {}", ex.getMessage());
    return error(HttpStatus.UNPROCESSABLE_ENTITY, ex, "Audio could not be processed");
  }

  @ExceptionHandler({ConfigurationException.class, IllegalArgumentException.class})
  public ResponseEntity<ApiError> handleConfiguration(RuntimeException ex) {
    LOGGER.warn("Invalid request: {}", ex.getMessage());
    return error(HttpStatus.BAD_REQUEST, ex, "Invalid transcription settings");
  }

  @ExceptionHandler(ObjectStoreException.class)
  public ResponseEntity<ApiError> handleObjectStore(ObjectStoreException ex) {
    LOGGER.error("Object store failure: {}", ex.getMessage(), ex);
    return error(HttpStatus.BAD_GATEWAY, ex, "Object store unavailable");
  }

  @ExceptionHandler(TaskRejectedException.class)
  public ResponseEntity<ApiError> handleRejected(TaskRejectedException ex) {
    LOGGER.warn("Job queue full: {}", ex.getMessage());
    return error(HttpStatus.SERVICE_UNAVAILABLE, ex, "Too many transcription jobs queued");
  }

  private static ResponseEntity<ApiError> error(
      HttpStatus status, RuntimeException ex, String message) {
    return ResponseEntity.status(status)
        .body(
            new ApiError(ex.getClass().getSimpleName(), message, ex.getMessage(), Instant.now()));
  }

  /** Error body returned to API clients. */
  public record ApiError(String errorCode, String message, String details, Instant timestamp) {}
}
