package com.scholary.dialect.transcriber.audio;

import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Picks a decoder by sniffing the container header.
 *
 * <p>WAV, AIFF and AU go to the in-process {@link WavAudioDecoder}. Everything else (MP3, M4A,
 * OGG, FLAC, WebM) goes to ffmpeg. If the in-process decoder rejects a file that looked like WAV
 * (an unusual codec inside a RIFF container, say), ffmpeg gets a second try. Without ffmpeg,
 * compressed audio is rejected with a message saying so.
 */
public class RoutingAudioDecoder implements AudioDecoder {

  private static final Logger LOGGER = LoggerFactory.getLogger(RoutingAudioDecoder.class);

  private static final int HEADER_BYTES = 12;

  private final AudioDecoder pcmDecoder;
  private final AudioDecoder ffmpegDecoder;

  /**
   * @param pcmDecoder decoder for the JDK-native containers
   * @param ffmpegDecoder decoder for everything else, or {@code null} when ffmpeg is disabled
   */
  public RoutingAudioDecoder(AudioDecoder pcmDecoder, AudioDecoder ffmpegDecoder) {
    this.pcmDecoder = pcmDecoder;
    this.ffmpegDecoder = ffmpegDecoder;
  }

  @Override
  public PcmAudio decode(byte[] encoded) {
    if (encoded == null || encoded.length == 0) {
      throw new EmptyAudioException("Audio input is empty");
    }
    if (!isNativeContainer(encoded)) {
      return requireFfmpeg().decode(encoded);
    }
    try {
      return pcmDecoder.decode(encoded);
    } catch (AudioFormatException e) {
      if (ffmpegDecoder == null) {
        throw e;
      }
      LOGGER.info("In-process decoder rejected audio, retrying with ffmpeg: {}", e.getMessage());
      return ffmpegDecoder.decode(encoded);
    }
  }

  @Override
  public PcmAudio decode(Path file) {
    byte[] header;
    try (InputStream in = Files.newInputStream(file)) {
      header = in.readNBytes(HEADER_BYTES);
    } catch (NoSuchFileException e) {
      throw new AudioFormatException("Audio file not found: " + file.getFileName(), e);
    } catch (IOException e) {
      throw new AudioFormatException("Failed to read audio file: " + file.getFileName(), e);
    }
    if (header.length == 0) {
      throw new EmptyAudioException("Audio input is empty");
    }
    if (!isNativeContainer(header)) {
      return requireFfmpeg().decode(file);
    }
    try {
      return pcmDecoder.decode(file);
    } catch (AudioFormatException e) {
      if (ffmpegDecoder == null) {
        throw e;
      }
      LOGGER.info("In-process decoder rejected audio, retrying with ffmpeg: {}", e.getMessage());
      return ffmpegDecoder.decode(file);
    }
  }

  private AudioDecoder requireFfmpeg() {
    if (ffmpegDecoder == null) {
      throw new AudioFormatException(
          "Unsupported audio format: only WAV, AIFF and AU are accepted while ffmpeg is disabled");
    }
    return ffmpegDecoder;
  }

  /** RIFF/WAVE, FORM/AIFF or AIFC, and Sun ".snd". */
  static boolean isNativeContainer(byte[] header) {
    if (header.length >= 12) {
      String outer = ascii(header, 0, 4);
      String inner = ascii(header, 8, 4);
      if (outer.equals("RIFF") && inner.equals("WAVE")) {
        return true;
      }
      if (outer.equals("FORM") && (inner.equals("AIFF") || inner.equals("AIFC"))) {
        return true;
      }
    }
    return header.length >= 4 && ascii(header, 0, 4).equals(".snd");
  }

  private static String ascii(byte[] bytes, int offset, int length) {
    return new String(bytes, offset, length, StandardCharsets.US_ASCII);
  }
}
