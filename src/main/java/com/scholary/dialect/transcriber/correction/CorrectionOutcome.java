package com.scholary.dialect.transcriber.correction;

/**
 * Outcome of a correction attempt.
 *
 * <p>A {@link Kind#FALLBACK} outcome carries the raw text with forced confirmation and the failure
 * that caused it; callers never see the failure as an exception.
 *
 * @param kind how the result was produced
 * @param result the correction to apply
 * @param cause the failure behind a fallback, null otherwise
 */
public record CorrectionOutcome(Kind kind, CorrectionResult result, Throwable cause) {

  public enum Kind {
    /** The corrector answered with a valid correction. */
    CORRECTED,
    /** The corrector failed, timed out or answered with something unparseable. */
    FALLBACK,
    /** Empty input; the corrector was not called. */
    SKIPPED
  }

  public static CorrectionOutcome corrected(CorrectionResult result) {
    return new CorrectionOutcome(Kind.CORRECTED, result, null);
  }

  public static CorrectionOutcome fallback(String originalText, Throwable cause) {
    return new CorrectionOutcome(Kind.FALLBACK, CorrectionResult.fallback(originalText), cause);
  }

  public static CorrectionOutcome skipped() {
    return new CorrectionOutcome(Kind.SKIPPED, CorrectionResult.empty(), null);
  }

  public boolean isFallback() {
    return kind == Kind.FALLBACK;
  }
}
