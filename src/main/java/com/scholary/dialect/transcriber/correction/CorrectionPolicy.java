package com.scholary.dialect.transcriber.correction;

/** Tier chosen for a chunk plus the instruction sent to the corrector. */
public record CorrectionPolicy(CorrectionTier tier, String instruction) {

  public static CorrectionPolicy of(CorrectionTier tier) {
    return new CorrectionPolicy(tier, tier.instruction());
  }

  public boolean requiresReview() {
    return tier == CorrectionTier.REVIEW;
  }
}
