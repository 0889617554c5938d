package com.scholary.dialect.transcriber.correction;

/** Thrown when the corrector cannot be reached or answers with an error. */
public class CorrectionServiceException extends RuntimeException {

  public CorrectionServiceException(String message) {
    super(message);
  }

  public CorrectionServiceException(String message, Throwable cause) {
    super(message, cause);
  }
}
