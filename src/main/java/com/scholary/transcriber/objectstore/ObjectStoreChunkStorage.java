package com.scholary.transcriber.objectstore;

import com.scholary.transcriber.store.ChunkStorage;
import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.util.ArrayList;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * {@link ChunkStorage} on top of object storage.
 *
 * <p>Pieces are stored as {@code chunks/<fileId>/<index>} with the index zero-padded so the
 * lexicographic listing order is the index order.
 */
public class ObjectStoreChunkStorage implements ChunkStorage {

  private static final Logger LOGGER = LoggerFactory.getLogger(ObjectStoreChunkStorage.class);

  private final ObjectStoreClient client;
  private final String bucket;

  public ObjectStoreChunkStorage(ObjectStoreClient client, String bucket) {
    this.client = client;
    this.bucket = bucket;
  }

  @Override
  public void put(String fileId, int index, byte[] data) {
    client.putObject(
        bucket, key(fileId, index), new ByteArrayInputStream(data), data.length, "application/octet-stream");
  }

  @Override
  public List<byte[]> getAll(String fileId) {
    List<String> keys = client.listKeys(bucket, prefix(fileId));
    List<byte[]> pieces = new ArrayList<>(keys.size());
    for (String key : keys) {
      try (InputStream in = client.getObjectStream(bucket, key)) {
        pieces.add(in.readAllBytes());
      } catch (IOException e) {
        throw new ObjectStoreException(
            String.format("Failed to read storage chunk: bucket=%s, key=%s", bucket, key), e);
      }
    }
    LOGGER.debug("Read {} storage chunks for file {}", pieces.size(), fileId);
    return pieces;
  }

  @Override
  public void deleteAll(String fileId) {
    for (String key : client.listKeys(bucket, prefix(fileId))) {
      client.deleteObject(bucket, key);
    }
  }

  static String key(String fileId, int index) {
    return String.format("%s%06d", prefix(fileId), index);
  }

  private static String prefix(String fileId) {
    return "chunks/" + fileId + "/";
  }
}
