package com.scholary.transcriber.objectstore;

import java.io.InputStream;
import java.util.List;

/**
 * Abstraction for object storage operations.
 *
 * <p>This interface decouples storage chunking from specific storage implementations (S3, MinIO,
 * GCS, etc.). It provides the essential operations we need: reading, writing, listing and deleting
 * objects.
 *
 * <p>Why an abstraction? Because we want to be able to swap storage backends without rewriting
 * business logic. Also makes testing easier - we can mock this interface.
 */
public interface ObjectStoreClient {

  /**
   * Retrieve an object as a stream.
   *
   * <p>The caller is responsible for closing the stream.
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
   * List keys under a prefix in lexicographic order.
   *
   * @param bucket the bucket name
   * @param prefix key prefix
   * @return matching keys, empty if none
   * @throws ObjectStoreException if listing fails
   */
  List<String> listKeys(String bucket, String prefix);

  /**
   * Delete an object. Deleting a missing object is not an error.
   *
   * @throws ObjectStoreException if deletion fails
   */
  void deleteObject(String bucket, String key);
}
