package com.scholary.dialect.transcriber.speech;

/**
 * The external speech-to-text model.
 *
 * <p>Implementations return the decoded text together with the per-step output distributions the
 * decoder used, so confidence can be derived locally. One instance is shared across all chunks of
 * a run and across concurrent runs.
 */
public interface SpeechModel {

  /**
   * Decode one window of mono audio.
   *
   * @param samples mono samples in [-1, 1]
   * @param sampleRate sample rate of {@code samples}
   * @param targetLanguage language the model should transcribe into, e.g. "arb"
   * @return decoded text and distributions; empty text is valid (silence)
   * @throws DecodeException if decoding fails
   */
  DecodeResult decode(float[] samples, int sampleRate, String targetLanguage);
}
