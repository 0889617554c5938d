package com.scholary.dialect.transcriber.audio;

/** Thrown when decodable input audio contains no samples. Fatal for a pipeline run. */
public class EmptyAudioException extends RuntimeException {

  public EmptyAudioException(String message) {
    super(message);
  }
}
