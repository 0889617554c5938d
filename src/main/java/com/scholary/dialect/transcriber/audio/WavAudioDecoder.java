package com.scholary.dialect.transcriber.audio;

import java.io.BufferedInputStream;
import java.io.ByteArrayInputStream;
import java.io.IOException;
import javax.sound.sampled.AudioFormat;
import javax.sound.sampled.AudioInputStream;
import javax.sound.sampled.AudioSystem;
import javax.sound.sampled.UnsupportedAudioFileException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * {@link AudioDecoder} backed by {@code javax.sound.sampled}.
 *
 * <p>Handles the containers the JDK understands (WAV, AIFF, AU). Integer PCM of 8, 16, 24 or 32
 * bits and 32/64-bit float PCM are read directly; any other encoding is converted to 16-bit signed
 * PCM through {@link AudioSystem} when a converter exists.
 */
public class WavAudioDecoder implements AudioDecoder {

  private static final Logger LOGGER = LoggerFactory.getLogger(WavAudioDecoder.class);

  @Override
  public PcmAudio decode(byte[] encoded) {
    if (encoded == null || encoded.length == 0) {
      throw new EmptyAudioException("Audio input is empty");
    }

    try (AudioInputStream source =
        AudioSystem.getAudioInputStream(
            new BufferedInputStream(new ByteArrayInputStream(encoded)))) {

      AudioInputStream pcmStream = toReadablePcm(source);
      AudioFormat format = pcmStream.getFormat();
      byte[] data = pcmStream.readAllBytes();

      LOGGER.debug(
          "Decoding audio: encoding={}, rate={}Hz, channels={}, bits={}, bytes={}",
          format.getEncoding(),
          format.getSampleRate(),
          format.getChannels(),
          format.getSampleSizeInBits(),
          data.length);

      return toPcm(data, format);

    } catch (UnsupportedAudioFileException e) {
      throw new AudioFormatException("Unsupported audio format", e);
    } catch (IOException e) {
      throw new AudioFormatException("Failed to read audio stream", e);
    }
  }

  private AudioInputStream toReadablePcm(AudioInputStream source) {
    AudioFormat format = source.getFormat();
    if (isDirectlyReadable(format)) {
      return source;
    }
    AudioFormat target =
        new AudioFormat(
            AudioFormat.Encoding.PCM_SIGNED,
            format.getSampleRate(),
            16,
            format.getChannels(),
            format.getChannels() * 2,
            format.getSampleRate(),
            false);
    if (!AudioSystem.isConversionSupported(target, format)) {
      throw new AudioFormatException("No PCM converter for encoding: " + format.getEncoding());
    }
    return AudioSystem.getAudioInputStream(target, source);
  }

  private static boolean isDirectlyReadable(AudioFormat format) {
    AudioFormat.Encoding encoding = format.getEncoding();
    int bits = format.getSampleSizeInBits();
    if (AudioFormat.Encoding.PCM_FLOAT.equals(encoding)) {
      return bits == 32 || bits == 64;
    }
    return (AudioFormat.Encoding.PCM_SIGNED.equals(encoding)
            || AudioFormat.Encoding.PCM_UNSIGNED.equals(encoding))
        && (bits == 8 || bits == 16 || bits == 24 || bits == 32);
  }

  private PcmAudio toPcm(byte[] data, AudioFormat format) {
    int channelCount = format.getChannels();
    if (channelCount <= 0) {
      throw new AudioFormatException("Audio has no channels");
    }
    int sampleRate = Math.round(format.getSampleRate());
    if (sampleRate <= 0) {
      throw new AudioFormatException("Audio has an unknown sample rate");
    }

    int bytesPerSample = format.getSampleSizeInBits() / 8;
    int frameSize = bytesPerSample * channelCount;
    int frames = data.length / frameSize;
    if (frames == 0) {
      throw new EmptyAudioException("Audio contains no frames");
    }

    float[][] channels = new float[channelCount][frames];
    for (int frame = 0; frame < frames; frame++) {
      for (int c = 0; c < channelCount; c++) {
        int offset = frame * frameSize + c * bytesPerSample;
        channels[c][frame] = readSample(data, offset, format);
      }
    }
    return new PcmAudio(channels, sampleRate);
  }

  private static float readSample(byte[] data, int offset, AudioFormat format) {
    int bytes = format.getSampleSizeInBits() / 8;
    boolean bigEndian = format.isBigEndian();

    long raw = 0;
    for (int i = 0; i < bytes; i++) {
      int b = data[offset + (bigEndian ? i : bytes - 1 - i)] & 0xFF;
      raw = (raw << 8) | b;
    }

    AudioFormat.Encoding encoding = format.getEncoding();
    if (AudioFormat.Encoding.PCM_FLOAT.equals(encoding)) {
      return bytes == 4
          ? Float.intBitsToFloat((int) raw)
          : (float) Double.longBitsToDouble(raw);
    }

    int bits = bytes * 8;
    double fullScale = Math.pow(2, bits - 1);
    if (AudioFormat.Encoding.PCM_UNSIGNED.equals(encoding)) {
      return (float) ((raw - fullScale) / fullScale);
    }
    // sign-extend
    long signed = (raw << (64 - bits)) >> (64 - bits);
    return (float) (signed / fullScale);
  }
}
