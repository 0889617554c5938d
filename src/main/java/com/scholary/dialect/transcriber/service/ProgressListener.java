package com.scholary.dialect.transcriber.service;

/** Receives a callback after each chunk of a run has been handled, whatever its fate. */
@FunctionalInterface
public interface ProgressListener {

  ProgressListener NONE = (processed, total) -> {};

  void onChunkProcessed(int chunksProcessed, int totalChunks);
}
