package com.scholary.dialect.transcriber.transcript;

/**
 * Tracks the state of a single chunk and rejects illegal transitions.
 *
 * <p>A chunk enters the lifecycle once decoded; a chunk whose decode fails never gets one and is
 * counted as dropped directly. Instances are confined to the thread driving the run.
 */
public final class ChunkLifecycle {

  private final int chunkIndex;
  private ChunkState state = ChunkState.DECODED;

  public ChunkLifecycle(int chunkIndex) {
    this.chunkIndex = chunkIndex;
  }

  /**
   * Move to the next state.
   *
   * @throws IllegalStateException if {@code next} does not follow the current state
   */
  public ChunkLifecycle transitionTo(ChunkState next) {
    if (!state.canTransitionTo(next)) {
      throw new IllegalStateException(
          String.format("Chunk %d cannot move from %s to %s", chunkIndex, state, next));
    }
    state = next;
    return this;
  }

  public int chunkIndex() {
    return chunkIndex;
  }

  public ChunkState state() {
    return state;
  }
}
