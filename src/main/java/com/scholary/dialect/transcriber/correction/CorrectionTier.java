package com.scholary.dialect.transcriber.correction;

/**
 * How aggressively a chunk is corrected and whether it is flagged for review.
 *
 * <p>Each tier carries the instruction text passed verbatim to the corrector.
 */
public enum CorrectionTier {
  AUTO("AUTO: High confidence. Make minimal changes."),
  SUGGEST("SUGGEST: Medium confidence. Standard correction."),
  REVIEW("REVIEW: Low confidence. Flag for human confirmation.");

  private final String instruction;

  CorrectionTier(String instruction) {
    this.instruction = instruction;
  }

  public String instruction() {
    return instruction;
  }
}
