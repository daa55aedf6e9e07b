package com.scholary.transcriber.store;

import java.util.List;

/** Backing storage for the pieces of large files. */
public interface ChunkStorage {

  void put(String fileId, int index, byte[] data);

  /** All pieces of a file in index order, empty when none exist. */
  List<byte[]> getAll(String fileId);

  void deleteAll(String fileId);
}
