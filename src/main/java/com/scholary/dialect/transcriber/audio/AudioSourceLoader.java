package com.scholary.dialect.transcriber.audio;

import com.scholary.dialect.transcriber.objectstore.ObjectStoreClient;
import com.scholary.dialect.transcriber.objectstore.ObjectStoreClient.ObjectMetadata;
import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.InvalidPathException;
import java.nio.file.Path;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Resolves an {@link AudioSource} to decoded PCM.
 *
 * <p>Local files are only read from inside the configured {@link AudioProperties#localRoot()};
 * paths that resolve outside it (through {@code ..}, an absolute path or a symlink) are rejected,
 * and local files are refused altogether when no root is configured. Object-store sources are
 * downloaded in full through the {@link ObjectStoreClient}. Either way the audio goes through the
 * {@link AudioDecoder}.
 */
@Component
public class AudioSourceLoader {

  private static final Logger LOGGER = LoggerFactory.getLogger(AudioSourceLoader.class);

  private final ObjectStoreClient objectStoreClient;
  private final AudioDecoder audioDecoder;
  private final Path localRoot;

  public AudioSourceLoader(
      ObjectStoreClient objectStoreClient, AudioDecoder audioDecoder, AudioProperties properties) {
    this.objectStoreClient = objectStoreClient;
    this.audioDecoder = audioDecoder;
    this.localRoot =
        properties.localFilesEnabled()
            ? Path.of(properties.localRoot()).toAbsolutePath().normalize()
            : null;
  }

  /**
   * Load and decode the audio behind {@code source}.
   *
   * @throws IllegalArgumentException if local files are disabled or the path leaves the local
   *     audio directory
   * @throws AudioFormatException if the file is missing, unreadable or not decodable
   * @throws EmptyAudioException if the audio has no samples
   * @throws com.scholary.dialect.transcriber.objectstore.ObjectStoreException if the download
   *     fails
   */
  public PcmAudio load(AudioSource source) {
    if (!source.isObjectStore()) {
      Path file = resolveLocal(source.path());
      LOGGER.info("Loading local audio: source={}", source.describe());
      return audioDecoder.decode(file);
    }
    byte[] bytes = download(source);
    LOGGER.info("Loaded audio: source={}, size={} KB", source.describe(), bytes.length / 1024);
    return audioDecoder.decode(bytes);
  }

  /**
   * Resolve a caller-supplied path against the local audio directory.
   *
   * <p>Error messages name only the path the caller sent, never the server-side location.
   */
  private Path resolveLocal(String requested) {
    if (localRoot == null) {
      throw new IllegalArgumentException("Local audio files are disabled; use an object source");
    }
    Path candidate;
    try {
      candidate = localRoot.resolve(requested).normalize();
    } catch (InvalidPathException e) {
      throw new IllegalArgumentException("Invalid audio path: " + requested);
    }
    if (!candidate.startsWith(localRoot)) {
      throw new IllegalArgumentException("Audio path is outside the local audio directory");
    }
    if (!Files.exists(candidate)) {
      throw new AudioFormatException("Audio file not found: " + requested);
    }
    try {
      Path real = candidate.toRealPath();
      if (!real.startsWith(localRoot.toRealPath())) {
        throw new IllegalArgumentException("Audio path is outside the local audio directory");
      }
      return real;
    } catch (IOException e) {
      throw new AudioFormatException("Failed to read audio file: " + requested, e);
    }
  }

  private byte[] download(AudioSource source) {
    ObjectMetadata metadata = objectStoreClient.getObjectMetadata(source.bucket(), source.key());
    LOGGER.debug(
        "Downloading audio object: source={}, contentLength={}, contentType={}",
        source.describe(),
        metadata.contentLength(),
        metadata.contentType());

    try (InputStream stream = objectStoreClient.getObjectStream(source.bucket(), source.key())) {
      return stream.readAllBytes();
    } catch (IOException e) {
      throw new AudioFormatException("Failed to read audio object: " + source.describe(), e);
    }
  }
}
