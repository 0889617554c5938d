package com.scholary.dialect.transcriber.chunking;

/** Boundaries of one planned chunk, in samples and seconds, without the audio itself. */
public record ChunkBoundary(
    int index, int startOffset, int endOffset, double startSeconds, double endSeconds) {

  public int length() {
    return endOffset - startOffset;
  }
}
