package com.scholary.dialect.transcriber.audio;

/**
 * Decoded PCM audio before normalization.
 *
 * <p>Samples are stored per channel ({@code channels[channel][frame]}) as floats. The sample rate
 * and channel count are whatever the source had; {@link AudioNormalizer} turns this into a
 * canonical {@link Waveform}.
 */
public record PcmAudio(float[][] channels, int sampleRate) {

  /** Wrap a single mono channel. */
  public static PcmAudio mono(float[] samples, int sampleRate) {
    return new PcmAudio(new float[][] {samples}, sampleRate);
  }

  public int channelCount() {
    return channels == null ? 0 : channels.length;
  }

  public int frameCount() {
    return channelCount() == 0 || channels[0] == null ? 0 : channels[0].length;
  }
}
