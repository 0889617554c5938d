package com.scholary.dialect.transcriber.config;

/**
 * Settings for one pipeline run.
 *
 * <p>Built from {@link PipelineProperties} and optionally overridden per request. The constructor
 * validates every field, so an instance is always usable.
 *
 * @param chunkDurationSeconds chunk length D
 * @param overlapSeconds overlap V between consecutive chunks, must be smaller than D
 * @param admissionConfidenceThreshold chunks at or below this confidence are dropped
 * @param autoTierThreshold confidence above which correction is minimal
 * @param suggestTierThreshold confidence above which correction is standard
 * @param targetLanguage language hint passed to the speech model
 * @param sampleRate canonical sample rate R
 */
public record PipelineConfig(
    double chunkDurationSeconds,
    double overlapSeconds,
    double admissionConfidenceThreshold,
    double autoTierThreshold,
    double suggestTierThreshold,
    String targetLanguage,
    int sampleRate) {

  public PipelineConfig {
    if (!(chunkDurationSeconds > 0)) {
      throw new ConfigurationException(
          "Chunk duration must be positive, got " + chunkDurationSeconds);
    }
    if (!(overlapSeconds >= 0)) {
      throw new ConfigurationException("Overlap must not be negative, got " + overlapSeconds);
    }
    if (overlapSeconds >= chunkDurationSeconds) {
      throw new ConfigurationException(
          String.format(
              "Overlap (%.3fs) must be smaller than chunk duration (%.3fs)",
              overlapSeconds, chunkDurationSeconds));
    }
    requireUnit("Admission threshold", admissionConfidenceThreshold);
    requireUnit("Auto tier threshold", autoTierThreshold);
    requireUnit("Suggest tier threshold", suggestTierThreshold);
    if (suggestTierThreshold > autoTierThreshold) {
      throw new ConfigurationException(
          String.format(
              "Suggest tier threshold (%.3f) must not exceed auto tier threshold (%.3f)",
              suggestTierThreshold, autoTierThreshold));
    }
    if (targetLanguage == null || targetLanguage.isBlank()) {
      throw new ConfigurationException("Target language must not be blank");
    }
    if (sampleRate <= 0) {
      throw new ConfigurationException("Sample rate must be positive, got " + sampleRate);
    }
    if (!(chunkDurationSeconds * sampleRate <= Integer.MAX_VALUE)) {
      throw new ConfigurationException(
          String.format(
              "Chunk duration (%.3fs) is too long for %dHz audio",
              chunkDurationSeconds, sampleRate));
    }
  }

  /**
   * Copy with per-request overrides applied. Null arguments keep the current value.
   *
   * @throws ConfigurationException if the resulting combination is invalid
   */
  public PipelineConfig withOverrides(
      Double chunkDurationSeconds,
      Double overlapSeconds,
      Double admissionConfidenceThreshold,
      String targetLanguage) {
    return new PipelineConfig(
        chunkDurationSeconds != null ? chunkDurationSeconds : this.chunkDurationSeconds,
        overlapSeconds != null ? overlapSeconds : this.overlapSeconds,
        admissionConfidenceThreshold != null
            ? admissionConfidenceThreshold
            : this.admissionConfidenceThreshold,
        this.autoTierThreshold,
        this.suggestTierThreshold,
        targetLanguage != null && !targetLanguage.isBlank() ? targetLanguage : this.targetLanguage,
        this.sampleRate);
  }

  private static void requireUnit(String name, double value) {
    if (!(value >= 0.0 && value <= 1.0)) {
      throw new ConfigurationException(name + " must be within [0, 1], got " + value);
    }
  }
}
