package com.scholary.dialect.transcriber.correction;

/**
 * Maps a confidence score to a {@link CorrectionPolicy}.
 *
 * <p>Both thresholds are exclusive lower bounds:
 *
 * <pre>
 * c &gt; auto              -&gt; AUTO
 * suggest &lt; c &lt;= auto  -&gt; SUGGEST
 * c &lt;= suggest          -&gt; REVIEW
 * </pre>
 */
public class CorrectionPolicyRouter {

  private final double autoThreshold;
  private final double suggestThreshold;

  public CorrectionPolicyRouter(double autoThreshold, double suggestThreshold) {
    if (suggestThreshold > autoThreshold) {
      throw new IllegalArgumentException(
          String.format(
              "Suggest threshold (%.3f) must not exceed auto threshold (%.3f)",
              suggestThreshold, autoThreshold));
    }
    this.autoThreshold = autoThreshold;
    this.suggestThreshold = suggestThreshold;
  }

  public CorrectionPolicy route(double confidence) {
    if (confidence > autoThreshold) {
      return CorrectionPolicy.of(CorrectionTier.AUTO);
    }
    if (confidence > suggestThreshold) {
      return CorrectionPolicy.of(CorrectionTier.SUGGEST);
    }
    return CorrectionPolicy.of(CorrectionTier.REVIEW);
  }
}
