package com.scholary.dialect.transcriber.chunking;

import java.util.Arrays;

/**
 * A contiguous slice of a {@link com.scholary.dialect.transcriber.audio.Waveform}.
 *
 * <p>{@code startOffset} and {@code length} are in samples. The chunk is consumed once by the
 * transcription engine and not retained afterwards.
 *
 * <p>The constructor takes ownership of {@code samples}; {@link #samples()} hands out a copy, so a
 * chunk cannot be changed after it is built.
 */
public record AudioChunk(int index, float[] samples, int startOffset, int length, int sampleRate) {

  @Override
  public float[] samples() {
    return samples.clone();
  }

  public int endOffset() {
    return startOffset + length;
  }

  public double startSeconds() {
    return (double) startOffset / sampleRate;
  }

  public double endSeconds() {
    return (double) endOffset() / sampleRate;
  }

  public double durationSeconds() {
    return (double) length / sampleRate;
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) {
      return true;
    }
    if (!(o instanceof AudioChunk)) {
      return false;
    }
    AudioChunk other = (AudioChunk) o;
    return index == other.index
        && startOffset == other.startOffset
        && length == other.length
        && sampleRate == other.sampleRate
        && Arrays.equals(samples, other.samples);
  }

  @Override
  public int hashCode() {
    int result = Arrays.hashCode(samples);
    result = 31 * result + index;
    result = 31 * result + startOffset;
    result = 31 * result + length;
    result = 31 * result + sampleRate;
    return result;
  }

  @Override
  public String toString() {
    return String.format(
        "AudioChunk[index=%d, startOffset=%d, length=%d, sampleRate=%d, samples=%d]",
        index, startOffset, length, sampleRate, samples.length);
  }
}
