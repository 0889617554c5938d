package com.scholary.dialect.transcriber.audio;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;

/** Decodes encoded audio into raw PCM. */
public interface AudioDecoder {

  /**
   * Decode container bytes (for example a WAV file) into PCM.
   *
   * @param encoded the raw bytes of the audio file
   * @return the decoded channels and their sample rate
   * @throws AudioFormatException if the bytes are not a supported audio format
   * @throws EmptyAudioException if the stream decodes to zero frames
   */
  PcmAudio decode(byte[] encoded);

  /**
   * Decode an audio file. Reads the file into memory and delegates to {@link #decode(byte[])};
   * decoders that can stream from disk override this.
   *
   * @throws AudioFormatException if the file is missing, unreadable or not a supported format
   */
  default PcmAudio decode(Path file) {
    try {
      return decode(Files.readAllBytes(file));
    } catch (NoSuchFileException e) {
      throw new AudioFormatException("Audio file not found: " + file.getFileName(), e);
    } catch (IOException e) {
      throw new AudioFormatException("Failed to read audio file: " + file.getFileName(), e);
    }
  }
}
