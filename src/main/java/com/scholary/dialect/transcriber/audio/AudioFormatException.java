package com.scholary.dialect.transcriber.audio;

/**
 * Thrown when input audio cannot be decoded or has no channels.
 *
 * <p>Fatal for a pipeline run: it is raised before any chunk is processed.
 */
public class AudioFormatException extends RuntimeException {

  public AudioFormatException(String message) {
    super(message);
  }

  public AudioFormatException(String message, Throwable cause) {
    super(message, cause);
  }
}
