package com.scholary.dialect.transcriber.correction;

/** Fixed-shape result of correcting one chunk. */
public record CorrectionResult(
    String correctedText, boolean changesMade, boolean requiresConfirmation, String originalText) {

  /** Result for empty input; the corrector is never called. */
  public static CorrectionResult empty() {
    return new CorrectionResult("", false, false, "");
  }

  /** Raw text passed through unchanged and flagged for confirmation. */
  public static CorrectionResult fallback(String originalText) {
    return new CorrectionResult(originalText, false, true, originalText);
  }

  public CorrectionResult withConfirmationRequired() {
    return requiresConfirmation
        ? this
        : new CorrectionResult(correctedText, changesMade, true, originalText);
  }
}
