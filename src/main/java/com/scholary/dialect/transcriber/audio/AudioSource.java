package com.scholary.dialect.transcriber.audio;

/**
 * Where the audio for a run comes from: a local file or an object in the object store.
 *
 * <p>Exactly one of {@code path} or {@code bucket}+{@code key} is set.
 */
public record AudioSource(String path, String bucket, String key) {

  public AudioSource {
    boolean hasPath = path != null && !path.isBlank();
    boolean hasObject = bucket != null && !bucket.isBlank() && key != null && !key.isBlank();
    if (hasPath == hasObject) {
      throw new IllegalArgumentException(
          "Audio source needs either a path or a bucket and key, not both or neither");
    }
  }

  public static AudioSource ofFile(String path) {
    return new AudioSource(path, null, null);
  }

  public static AudioSource ofObject(String bucket, String key) {
    return new AudioSource(null, bucket, key);
  }

  public boolean isObjectStore() {
    return path == null || path.isBlank();
  }

  /** Human-readable location for logs. */
  public String describe() {
    return isObjectStore() ? String.format("s3://%s/%s", bucket, key) : path;
  }
}
