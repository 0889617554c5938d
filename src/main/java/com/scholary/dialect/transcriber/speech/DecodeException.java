package com.scholary.dialect.transcriber.speech;

/**
 * Thrown when the speech model fails to decode a chunk.
 *
 * <p>Chunk-scoped: the orchestrator drops the chunk and continues with the next one.
 */
public class DecodeException extends RuntimeException {

  public DecodeException(String message) {
    super(message);
  }

  public DecodeException(String message, Throwable cause) {
    super(message, cause);
  }
}
