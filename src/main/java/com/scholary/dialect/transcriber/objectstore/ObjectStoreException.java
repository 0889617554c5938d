package com.scholary.dialect.transcriber.objectstore;

/**
 * Thrown when an audio object cannot be fetched from the object store.
 *
 * <p>Fatal for a pipeline run, since the audio is a precondition of every chunk.
 */
public class ObjectStoreException extends RuntimeException {

  public ObjectStoreException(String message) {
    super(message);
  }

  public ObjectStoreException(String message, Throwable cause) {
    super(message, cause);
  }
}
