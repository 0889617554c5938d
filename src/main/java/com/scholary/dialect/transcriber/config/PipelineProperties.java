package com.scholary.dialect.transcriber.config;

import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Positive;
import jakarta.validation.constraints.PositiveOrZero;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * Pipeline defaults ("pipeline.*").
 *
 * <p>Durations are in seconds; thresholds are confidences in [0, 1].
 */
@ConfigurationProperties(prefix = "pipeline")
@Validated
public record PipelineProperties(
    @Positive double chunkDurationSec,
    @PositiveOrZero double overlapSec,
    @DecimalMin("0.0") @DecimalMax("1.0") double admissionConfidenceThreshold,
    @DecimalMin("0.0") @DecimalMax("1.0") double autoTierThreshold,
    @DecimalMin("0.0") @DecimalMax("1.0") double suggestTierThreshold,
    @DecimalMin("0.0") @DecimalMax("1.0") double confirmationOverrideThreshold,
    @NotBlank String targetLanguage,
    @Positive int sampleRate,
    @Positive int correctionTimeoutSeconds) {

  public PipelineConfig toPipelineConfig() {
    return new PipelineConfig(
        chunkDurationSec,
        overlapSec,
        admissionConfidenceThreshold,
        autoTierThreshold,
        suggestTierThreshold,
        targetLanguage,
        sampleRate);
  }
}
