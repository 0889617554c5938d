package com.scholary.dialect.transcriber.transcript;

import java.util.EnumSet;
import java.util.Set;

/**
 * Lifecycle of one chunk within a pipeline run.
 *
 * <pre>
 * DECODED  -&gt; ADMITTED | DROPPED
 * ADMITTED -&gt; CORRECTED | DROPPED
 * CORRECTED -&gt; ASSEMBLED
 * </pre>
 *
 * <p>DROPPED and ASSEMBLED are terminal.
 */
public enum ChunkState {
  DECODED,
  ADMITTED,
  CORRECTED,
  ASSEMBLED,
  DROPPED;

  public Set<ChunkState> successors() {
    if (this == DECODED) {
      return EnumSet.of(ADMITTED, DROPPED);
    }
    if (this == ADMITTED) {
      return EnumSet.of(CORRECTED, DROPPED);
    }
    if (this == CORRECTED) {
      return EnumSet.of(ASSEMBLED);
    }
    return EnumSet.noneOf(ChunkState.class);
  }

  public boolean canTransitionTo(ChunkState next) {
    return successors().contains(next);
  }

  public boolean isTerminal() {
    return this == ASSEMBLED || this == DROPPED;
  }
}
