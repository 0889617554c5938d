package com.scholary.dialect.transcriber.config;

/** Thrown when pipeline settings are invalid, at startup or when validating a request. */
public class ConfigurationException extends RuntimeException {

  public ConfigurationException(String message) {
    super(message);
  }

  public ConfigurationException(String message, Throwable cause) {
    super(message, cause);
  }
}
