package com.scholary.dialect.transcriber.audio;

import java.io.BufferedInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.concurrent.TimeUnit;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * {@link AudioDecoder} that shells out to ffmpeg.
 *
 * <p>Covers the compressed formats the JDK cannot read (MP3, AAC/M4A, OGG/Opus, FLAC, WebM and
 * video containers). ffmpeg downmixes to mono and resamples to the pipeline rate, then writes raw
 * 16-bit little-endian PCM to a temp file that is read back as floats.
 */
public class FfmpegAudioDecoder implements AudioDecoder {

  private static final Logger LOGGER = LoggerFactory.getLogger(FfmpegAudioDecoder.class);

  private static final int STDERR_TAIL_CHARS = 2000;

  private final FfmpegProperties properties;
  private final int targetSampleRate;

  public FfmpegAudioDecoder(FfmpegProperties properties, int targetSampleRate) {
    this.properties = properties;
    this.targetSampleRate = targetSampleRate;
  }

  @Override
  public PcmAudio decode(byte[] encoded) {
    if (encoded == null || encoded.length == 0) {
      throw new EmptyAudioException("Audio input is empty");
    }
    Path input = null;
    try {
      input = Files.createTempFile("ffmpeg-in-", ".bin");
      Files.write(input, encoded);
      return decode(input);
    } catch (IOException e) {
      throw new AudioFormatException("Failed to stage audio for ffmpeg", e);
    } finally {
      deleteQuietly(input);
    }
  }

  @Override
  public PcmAudio decode(Path file) {
    if (!Files.isRegularFile(file)) {
      throw new AudioFormatException("Audio file not found: " + file.getFileName());
    }

    Path output = null;
    Path errors = null;
    try {
      output = Files.createTempFile("ffmpeg-out-", ".pcm");
      errors = Files.createTempFile("ffmpeg-err-", ".log");

      List<String> command =
          List.of(
              properties.binary(),
              "-nostdin",
              "-hide_banner",
              "-loglevel", "error",
              "-y",
              "-i", file.toString(),
              "-vn",
              "-ac", "1",
              "-ar", String.valueOf(targetSampleRate),
              "-f", "s16le",
              "-acodec", "pcm_s16le",
              output.toString());

      LOGGER.debug("Running ffmpeg: input={}, rate={}Hz", file.getFileName(), targetSampleRate);

      ProcessBuilder pb = new ProcessBuilder(command);
      pb.redirectOutput(ProcessBuilder.Redirect.DISCARD);
      pb.redirectError(errors.toFile());

      Process process = pb.start();
      if (!process.waitFor(properties.timeoutSeconds(), TimeUnit.SECONDS)) {
        process.destroyForcibly();
        throw new AudioFormatException(
            "ffmpeg timed out after " + properties.timeoutSeconds() + "s");
      }

      int exitCode = process.exitValue();
      if (exitCode != 0) {
        LOGGER.error(
            "ffmpeg failed: input={}, exitCode={}, stderr={}",
            file.getFileName(),
            exitCode,
            tail(errors));
        throw new AudioFormatException(
            "ffmpeg could not decode audio (exit code " + exitCode + ")");
      }

      float[] samples = readPcm16(output);
      if (samples.length == 0) {
        throw new EmptyAudioException("Audio contains no samples");
      }
      LOGGER.debug("ffmpeg decoded {} samples at {}Hz", samples.length, targetSampleRate);
      return PcmAudio.mono(samples, targetSampleRate);

    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      throw new AudioFormatException("ffmpeg decoding interrupted", e);
    } catch (IOException e) {
      throw new AudioFormatException("Failed to run ffmpeg: " + properties.binary(), e);
    } finally {
      deleteQuietly(output);
      deleteQuietly(errors);
    }
  }

  private static float[] readPcm16(Path pcm) throws IOException {
    long size = Files.size(pcm);
    if (size / 2 > Integer.MAX_VALUE) {
      throw new AudioFormatException("Decoded audio is too long");
    }
    float[] samples = new float[(int) (size / 2)];
    try (InputStream in = new BufferedInputStream(Files.newInputStream(pcm))) {
      for (int i = 0; i < samples.length; i++) {
        int lo = in.read();
        int hi = in.read();
        if (lo < 0 || hi < 0) {
          throw new AudioFormatException("Truncated ffmpeg output");
        }
        samples[i] = (short) ((hi << 8) | lo) / 32768f;
      }
    }
    return samples;
  }

  private static String tail(Path log) {
    try {
      String text = Files.readString(log, StandardCharsets.UTF_8).trim();
      return text.length() <= STDERR_TAIL_CHARS
          ? text
          : text.substring(text.length() - STDERR_TAIL_CHARS);
    } catch (IOException e) {
      return "<unreadable: " + e.getMessage() + ">";
    }
  }

  private static void deleteQuietly(Path path) {
    if (path == null) {
      return;
    }
    try {
      Files.deleteIfExists(path);
    } catch (IOException e) {
      LOGGER.warn("Failed to delete temp file: {}", path, e);
    }
  }
}
