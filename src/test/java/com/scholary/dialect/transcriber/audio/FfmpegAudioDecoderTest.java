package com.scholary.dialect.transcriber.audio;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.attribute.PosixFilePermissions;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.condition.DisabledOnOs;
import org.junit.jupiter.api.condition.OS;
import org.junit.jupiter.api.io.TempDir;

/** Runs the decoder against small shell scripts standing in for the ffmpeg binary. */
@DisabledOnOs(OS.WINDOWS)
class FfmpegAudioDecoderTest {

  @TempDir Path tempDir;

  @Test
  void decode_readsSigned16BitOutputAsMono() throws Exception {
    // 0x4000 and 0xC000 little-endian, written to the last argument
    Path ffmpeg =
        script(
            "for last; do :; done\n"
                + "case \"$*\" in *'-ar 16000'*) ;; *) exit 3 ;; esac\n"
                + "printf '\\000\\100\\000\\300' > \"$last\"\n");
    FfmpegAudioDecoder decoder = new FfmpegAudioDecoder(properties(ffmpeg), 16000);

    PcmAudio audio = decoder.decode(new byte[] {'I', 'D', '3', 4, 0});

    assertThat(audio.sampleRate()).isEqualTo(16000);
    assertThat(audio.channelCount()).isEqualTo(1);
    assertThat(audio.channels()[0]).hasSize(2);
    assertThat(audio.channels()[0][0]).isCloseTo(0.5f, within(1e-6f));
    assertThat(audio.channels()[0][1]).isCloseTo(-0.5f, within(1e-6f));
  }

  @Test
  void decode_nonZeroExitIsAnAudioError() throws Exception {
    Path ffmpeg = script("echo 'Invalid data found when processing input' >&2\nexit 1\n");
    FfmpegAudioDecoder decoder = new FfmpegAudioDecoder(properties(ffmpeg), 16000);

    assertThatThrownBy(() -> decoder.decode(new byte[] {1, 2, 3}))
        .isInstanceOf(AudioFormatException.class)
        .hasMessageContaining("exit code 1");
  }

  @Test
  void decode_emptyOutputIsEmptyAudio() throws Exception {
    Path ffmpeg = script("exit 0\n");
    FfmpegAudioDecoder decoder = new FfmpegAudioDecoder(properties(ffmpeg), 16000);

    assertThatThrownBy(() -> decoder.decode(new byte[] {1, 2, 3}))
        .isInstanceOf(EmptyAudioException.class);
  }

  @Test
  void decode_missingBinaryIsAnAudioError() {
    FfmpegAudioDecoder decoder =
        new FfmpegAudioDecoder(properties(tempDir.resolve("no-such-ffmpeg")), 16000);

    assertThatThrownBy(() -> decoder.decode(new byte[] {1, 2, 3}))
        .isInstanceOf(AudioFormatException.class)
        .hasMessageContaining("Failed to run ffmpeg");
  }

  @Test
  void decode_killsProcessAfterTimeout() throws Exception {
    Path ffmpeg = script("sleep 30\n");
    FfmpegAudioDecoder decoder =
        new FfmpegAudioDecoder(new FfmpegProperties(true, ffmpeg.toString(), 1), 16000);

    assertThatThrownBy(() -> decoder.decode(new byte[] {1, 2, 3}))
        .isInstanceOf(AudioFormatException.class)
        .hasMessageContaining("timed out");
  }

  @Test
  void decode_emptyInputIsEmptyAudio() {
    FfmpegAudioDecoder decoder = new FfmpegAudioDecoder(properties(tempDir), 16000);

    assertThatThrownBy(() -> decoder.decode(new byte[0])).isInstanceOf(EmptyAudioException.class);
  }

  private Path script(String body) throws Exception {
    Path file = tempDir.resolve("ffmpeg");
    Files.writeString(file, "#!/bin/sh\n" + body, StandardCharsets.UTF_8);
    Files.setPosixFilePermissions(file, PosixFilePermissions.fromString("rwxr-xr-x"));
    return file;
  }

  private static FfmpegProperties properties(Path binary) {
    return new FfmpegProperties(true, binary.toString(), 30);
  }
}
