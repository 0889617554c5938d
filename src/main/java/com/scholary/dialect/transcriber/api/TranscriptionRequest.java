package com.scholary.dialect.transcriber.api;

import com.scholary.dialect.transcriber.audio.AudioSource;
import com.scholary.dialect.transcriber.config.PipelineConfig;
import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;

/**
 * Request for transcribing an audio file.
 *
 * <p>The audio comes either from a local {@code path} or from {@code bucket}+{@code key} in the
 * object store. Optional fields override the pipeline defaults for this request only. Chunks are
 * limited to an hour and overlaps to ten minutes.
 */
public record TranscriptionRequest(
    String path,
    String bucket,
    String key,
    @DecimalMin("1.0") @DecimalMax("3600.0") Double chunkDurationSec,
    @DecimalMin("0.0") @DecimalMax("600.0") Double overlapSec,
    @DecimalMin("0.0") @DecimalMax("1.0") Double admissionConfidenceThreshold,
    String targetLanguage) {

  /**
   * @throws IllegalArgumentException if the request names neither or both kinds of source
   */
  public AudioSource toAudioSource() {
    return new AudioSource(path, bucket, key);
  }

  public PipelineConfig applyTo(PipelineConfig defaults) {
    return defaults.withOverrides(
        chunkDurationSec, overlapSec, admissionConfidenceThreshold, targetLanguage);
  }
}
