package com.scholary.dialect.transcriber.confidence;

import java.util.List;

/**
 * Chunk confidence plus the per-step values it was averaged from.
 *
 * <p>The per-step values are kept for diagnostics only.
 */
public record ConfidenceScore(double value, List<Double> stepConfidences) {

  public static final ConfidenceScore ZERO = new ConfidenceScore(0.0, List.of());

  public ConfidenceScore {
    stepConfidences = List.copyOf(stepConfidences);
  }
}
