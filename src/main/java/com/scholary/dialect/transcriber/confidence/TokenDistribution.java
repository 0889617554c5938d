package com.scholary.dialect.transcriber.confidence;

import java.util.List;

/**
 * Output probability vectors of one decode, one vector per decoding step.
 *
 * <p>Ephemeral: consumed by {@link ConfidenceEstimator} right after decoding and then discarded.
 */
public record TokenDistribution(List<double[]> steps) {

  public static final TokenDistribution EMPTY = new TokenDistribution(List.of());

  public TokenDistribution {
    steps = steps == null ? List.of() : List.copyOf(steps);
  }

  public int stepCount() {
    return steps.size();
  }

  /** Vocabulary size, taken from the first step; 0 when there are no steps. */
  public int vocabularySize() {
    return steps.isEmpty() ? 0 : steps.get(0).length;
  }
}
