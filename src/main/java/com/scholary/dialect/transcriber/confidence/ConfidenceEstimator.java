package com.scholary.dialect.transcriber.confidence;

import java.util.ArrayList;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Estimates decoder certainty from normalized entropy.
 *
 * <p>For each step t with probabilities p over a vocabulary of size V:
 *
 * <pre>
 * H_t = -sum(p * log(p + eps))
 * c_t = clamp(1 - H_t / log(V), 0, 1)
 * </pre>
 *
 * <p>The chunk confidence is the mean of c_t. A uniform distribution scores 0, a one-hot
 * distribution scores 1. No steps, or {@code V <= 1}, scores 0.
 */
@Component
public class ConfidenceEstimator {

  private static final Logger LOGGER = LoggerFactory.getLogger(ConfidenceEstimator.class);

  static final double EPSILON = 1e-12;

  /**
   * Compute the confidence of one decode.
   *
   * @throws IllegalArgumentException if steps disagree on the vocabulary size
   */
  public ConfidenceScore estimate(TokenDistribution distribution) {
    int vocabularySize = distribution.vocabularySize();
    if (distribution.stepCount() == 0 || vocabularySize <= 1) {
      return ConfidenceScore.ZERO;
    }

    double maxEntropy = Math.log(vocabularySize);
    List<Double> stepConfidences = new ArrayList<>(distribution.stepCount());
    double sum = 0.0;

    for (int t = 0; t < distribution.stepCount(); t++) {
      double[] probabilities = distribution.steps().get(t);
      if (probabilities.length != vocabularySize) {
        throw new IllegalArgumentException(
            String.format(
                "Step %d has %d probabilities, expected %d",
                t, probabilities.length, vocabularySize));
      }
      double confidence = clamp(1.0 - entropy(probabilities) / maxEntropy);
      stepConfidences.add(confidence);
      sum += confidence;
    }

    double mean = sum / stepConfidences.size();
    LOGGER.debug(
        "Estimated confidence: steps={}, vocabularySize={}, confidence={}",
        stepConfidences.size(),
        vocabularySize,
        mean);
    return new ConfidenceScore(mean, stepConfidences);
  }

  private static double entropy(double[] probabilities) {
    double entropy = 0.0;
    for (double p : probabilities) {
      entropy -= p * Math.log(p + EPSILON);
    }
    return entropy;
  }

  private static double clamp(double value) {
    if (Double.isNaN(value)) {
      return 0.0;
    }
    return Math.max(0.0, Math.min(1.0, value));
  }
}
