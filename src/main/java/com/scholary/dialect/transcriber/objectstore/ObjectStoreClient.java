package com.scholary.dialect.transcriber.objectstore;

import java.io.InputStream;

/**
 * Read access to the object store holding uploaded recordings.
 *
 * <p>Implementations exist for S3 and S3-compatible stores such as MinIO. Tests mock this
 * interface.
 */
public interface ObjectStoreClient {

  /**
   * Retrieve an audio object as a stream. The caller closes the stream.
   *
   * @param bucket the bucket name
   * @param key the object key
   * @return an input stream over the object's bytes
   * @throws ObjectStoreException if the object doesn't exist or retrieval fails
   */
  InputStream getObjectStream(String bucket, String key);

  /**
   * Get object metadata without downloading the content.
   *
   * @param bucket the bucket name
   * @param key the object key
   * @return object metadata
   * @throws ObjectStoreException if the object doesn't exist or retrieval fails
   */
  ObjectMetadata getObjectMetadata(String bucket, String key);

  /** Object metadata returned by getObjectMetadata. */
  record ObjectMetadata(long contentLength, String contentType) {}
}
