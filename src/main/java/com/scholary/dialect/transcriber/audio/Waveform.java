package com.scholary.dialect.transcriber.audio;

import java.util.Arrays;

/**
 * Immutable mono waveform at a fixed sample rate with amplitude in [-1, 1].
 *
 * <p>Produced once per run by {@link AudioNormalizer}. The backing array is never exposed;
 * callers read slices through {@link #slice(int, int)}.
 */
public final class Waveform {

  private final float[] samples;
  private final int sampleRate;

  public Waveform(float[] samples, int sampleRate) {
    this(sampleRate, samples.clone());
  }

  private Waveform(int sampleRate, float[] samples) {
    if (sampleRate <= 0) {
      throw new IllegalArgumentException("Sample rate must be positive: " + sampleRate);
    }
    this.samples = samples;
    this.sampleRate = sampleRate;
  }

  /** Wrap an array nobody else holds a reference to, without copying it. */
  static Waveform adopt(float[] samples, int sampleRate) {
    return new Waveform(sampleRate, samples);
  }

  public int sampleRate() {
    return sampleRate;
  }

  public int length() {
    return samples.length;
  }

  public double durationSeconds() {
    return (double) samples.length / sampleRate;
  }

  /**
   * Copy of the samples in {@code [from, to)}.
   *
   * @throws IndexOutOfBoundsException if the range falls outside the waveform
   */
  public float[] slice(int from, int to) {
    if (from < 0 || to > samples.length || from > to) {
      throw new IndexOutOfBoundsException(
          String.format("Invalid slice [%d, %d) of %d samples", from, to, samples.length));
    }
    return Arrays.copyOfRange(samples, from, to);
  }
}
