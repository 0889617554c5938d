package com.scholary.dialect.transcriber.transcript;

/**
 * Decoded text of one chunk with its derived confidence.
 *
 * <p>Offsets are in samples of the normalized waveform and only serve diagnostics.
 */
public record ChunkTranscript(
    int chunkIndex,
    String rawText,
    double confidence,
    int tokenCount,
    int startOffset,
    int endOffset,
    int sampleRate) {

  public boolean isEmpty() {
    return rawText == null || rawText.isBlank();
  }

  public double startSeconds() {
    return (double) startOffset / sampleRate;
  }

  public double endSeconds() {
    return (double) endOffset / sampleRate;
  }
}
