package com.scholary.dialect.transcriber.correction;

/** Thrown when the corrector's reply is not a valid correction object. */
public class CorrectionParseException extends RuntimeException {

  public CorrectionParseException(String message) {
    super(message);
  }

  public CorrectionParseException(String message, Throwable cause) {
    super(message, cause);
  }
}
