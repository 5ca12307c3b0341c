package com.scholary.notes.objectstore;

import java.io.InputStream;

/**
 * Abstraction for object storage operations.
 *
 * <p>The pipeline reads submitted inputs from the store and, when the object-store artifact
 * backend is selected, writes its outputs back. Mock this interface in tests.
 */
public interface ObjectStoreClient {

  /**
   * Retrieve an object as a stream. The caller closes the stream.
   *
   * @param bucket the bucket name
   * @param key the object key
   * @return an input stream for reading the object
   * @throws ObjectStoreException if the object doesn't exist or retrieval fails
   */
  InputStream getObjectStream(String bucket, String key);

  /**
   * Store an object from a stream.
   *
   * @param bucket the bucket name
   * @param key the object key
   * @param data the input stream containing object data
   * @param contentLength the size of the object in bytes
   * @param contentType the MIME type of the object
   * @throws ObjectStoreException if the upload fails
   */
  void putObject(
      String bucket, String key, InputStream data, long contentLength, String contentType);

  /**
   * Get object metadata without downloading the content.
   *
   * @param bucket the bucket name
   * @param key the object key
   * @return object metadata
   * @throws ObjectStoreException if the object doesn't exist or retrieval fails
   */
  ObjectMetadata getObjectMetadata(String bucket, String key);

  /**
   * Check whether an object exists.
   *
   * @param bucket the bucket name
   * @param key the object key
   * @return true if a HEAD request finds the object
   * @throws ObjectStoreException if the store can't answer
   */
  boolean objectExists(String bucket, String key);

  /** Object metadata returned by getObjectMetadata. */
  record ObjectMetadata(long contentLength, String contentType) {}
}
