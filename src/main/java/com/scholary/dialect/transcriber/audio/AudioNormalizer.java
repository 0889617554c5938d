package com.scholary.dialect.transcriber.audio;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Turns decoded PCM into the canonical {@link Waveform} the pipeline works on.
 *
 * <p>Three steps, always in this order:
 *
 * <ol>
 *   <li>Downmix: average all channels into one.
 *   <li>Resample: band-limited interpolation with a Hann-windowed sinc kernel. When downsampling,
 *       the kernel's cutoff sits just below the target Nyquist frequency so content above it is
 *       filtered out instead of folding back. Deterministic, so the same input always produces the
 *       same samples and therefore the same chunk boundaries.
 *   <li>Peak-normalize: divide by {@code max(|x|) + 1e-8}.
 * </ol>
 *
 * <p>The input channels are never modified. At most one working array is allocated per call and
 * handed to the resulting {@link Waveform} without a further copy.
 */
@Component
public class AudioNormalizer {

  private static final Logger LOGGER = LoggerFactory.getLogger(AudioNormalizer.class);

  static final double PEAK_EPSILON = 1e-8;

  /** Zero crossings of the sinc kernel on each side of the center. */
  static final int LOWPASS_FILTER_WIDTH = 6;

  /** Cutoff as a fraction of the lower of the two Nyquist frequencies. */
  static final double ROLLOFF = 0.99;

  private static final int MAX_CACHED_PHASES = 4096;

  /**
   * Normalize audio to mono at {@code targetSampleRate} with amplitude at most 1.
   *
   * @throws AudioFormatException if the audio has no channels, ragged channels or a bad rate
   * @throws EmptyAudioException if the audio has no frames
   */
  public Waveform normalize(PcmAudio audio, int targetSampleRate) {
    if (audio == null || audio.channelCount() == 0) {
      throw new AudioFormatException("Audio has no channels");
    }
    if (audio.sampleRate() <= 0) {
      throw new AudioFormatException("Invalid source sample rate: " + audio.sampleRate());
    }
    if (targetSampleRate <= 0) {
      throw new AudioFormatException("Invalid target sample rate: " + targetSampleRate);
    }

    float[] mono = downmix(audio);
    if (mono.length == 0) {
      throw new EmptyAudioException("Audio contains no samples");
    }

    LOGGER.debug(
        "Normalizing audio: channels={}, frames={}, sourceRate={}Hz, targetRate={}Hz",
        audio.channelCount(),
        mono.length,
        audio.sampleRate(),
        targetSampleRate);

    float[] resampled = resample(mono, audio.sampleRate(), targetSampleRate);
    if (resampled == audio.channels()[0]) {
      resampled = resampled.clone();
    }
    peakNormalize(resampled);

    Waveform waveform = Waveform.adopt(resampled, targetSampleRate);
    LOGGER.info(
        "Normalized audio: samples={}, duration={}s, rate={}Hz",
        waveform.length(),
        String.format("%.2f", waveform.durationSeconds()),
        targetSampleRate);
    return waveform;
  }

  /** Average of all channels; a single channel is returned as is. */
  private float[] downmix(PcmAudio audio) {
    float[][] channels = audio.channels();
    int frames = audio.frameCount();
    for (int c = 0; c < channels.length; c++) {
      if (channels[c] == null || channels[c].length != frames) {
        throw new AudioFormatException("Channel " + c + " length does not match channel 0");
      }
    }
    if (channels.length == 1) {
      return channels[0];
    }

    float[] mono = new float[frames];
    for (int i = 0; i < frames; i++) {
      double sum = 0.0;
      for (float[] channel : channels) {
        sum += channel[i];
      }
      mono[i] = (float) (sum / channels.length);
    }
    return mono;
  }

  /**
   * Resample {@code input} from {@code sourceRate} to {@code targetRate}.
   *
   * <p>Output sample {@code i} sits at source position {@code i * sourceRate / targetRate}. Its
   * value is the kernel-weighted sum of the source samples within {@code LOWPASS_FILTER_WIDTH}
   * zero crossings, with the weights renormalized to unit sum so that the truncated kernels at
   * both ends keep a DC gain of one. Returns {@code input} itself when the rates are equal.
   */
  static float[] resample(float[] input, int sourceRate, int targetRate) {
    if (sourceRate == targetRate) {
      return input;
    }
    long outLength = Math.max(1, Math.round((double) input.length * targetRate / sourceRate));
    if (outLength > Integer.MAX_VALUE) {
      throw new AudioFormatException("Audio is too long to resample to " + targetRate + "Hz");
    }

    int gcd = gcd(sourceRate, targetRate);
    int phases = targetRate / gcd;
    long step = sourceRate / gcd;

    double cutoff = Math.min(1.0, (double) targetRate / sourceRate) * ROLLOFF;
    int halfTaps = (int) Math.ceil(LOWPASS_FILTER_WIDTH / cutoff);
    int taps = 2 * halfTaps;

    double[][] kernels = phases <= MAX_CACHED_PHASES ? new double[phases][] : null;
    double[] scratch = new double[taps];
    float[] output = new float[(int) outLength];

    for (int i = 0; i < output.length; i++) {
      long numerator = i * step;
      long base = numerator / phases;
      int phase = (int) (numerator % phases);

      double[] kernel;
      if (kernels != null) {
        if (kernels[phase] == null) {
          kernels[phase] = fillKernel(new double[taps], (double) phase / phases, cutoff, halfTaps);
        }
        kernel = kernels[phase];
      } else {
        kernel = fillKernel(scratch, (double) phase / phases, cutoff, halfTaps);
      }

      double sum = 0.0;
      double weight = 0.0;
      long first = base - halfTaps + 1;
      for (int t = 0; t < taps; t++) {
        long index = first + t;
        if (index < 0 || index >= input.length) {
          continue;
        }
        sum += input[(int) index] * kernel[t];
        weight += kernel[t];
      }
      output[i] = weight == 0.0 ? 0f : (float) (sum / weight);
    }
    return output;
  }

  /**
   * Kernel weights for an output position {@code fraction} past source sample {@code base}; tap
   * {@code t} belongs to source sample {@code base - halfTaps + 1 + t}.
   */
  private static double[] fillKernel(
      double[] kernel, double fraction, double cutoff, int halfTaps) {
    double halfWidth = LOWPASS_FILTER_WIDTH / cutoff;
    for (int t = 0; t < kernel.length; t++) {
      double distance = fraction + halfTaps - 1 - t;
      kernel[t] = cutoff * sinc(cutoff * distance) * hann(distance / halfWidth);
    }
    return kernel;
  }

  private static double sinc(double x) {
    if (x == 0.0) {
      return 1.0;
    }
    double px = Math.PI * x;
    return Math.sin(px) / px;
  }

  private static double hann(double x) {
    if (Math.abs(x) >= 1.0) {
      return 0.0;
    }
    return 0.5 * (1.0 + Math.cos(Math.PI * x));
  }

  private static int gcd(int a, int b) {
    while (b != 0) {
      int r = a % b;
      a = b;
      b = r;
    }
    return a;
  }

  private static void peakNormalize(float[] samples) {
    float peak = 0f;
    for (float s : samples) {
      peak = Math.max(peak, Math.abs(s));
    }
    double divisor = peak + PEAK_EPSILON;
    for (int i = 0; i < samples.length; i++) {
      samples[i] = (float) (samples[i] / divisor);
    }
  }
}
