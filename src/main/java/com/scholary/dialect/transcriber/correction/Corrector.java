package com.scholary.dialect.transcriber.correction;

/**
 * The external dialect-preserving corrector.
 *
 * <p>Returns the corrector's raw reply; {@link CorrectionService} parses and validates it.
 * Implementations may be called from several threads at once.
 */
public interface Corrector {

  /**
   * Ask the corrector to fix one chunk of ASR text.
   *
   * @param request the text, its confidence and the tier instruction
   * @return the raw reply, expected to contain a JSON object
   * @throws CorrectionServiceException on transport failure or an error response
   */
  String correct(CorrectionRequest request);
}
