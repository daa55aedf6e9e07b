package com.scholary.transcriber.store;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentSkipListMap;

/** Heap-backed {@link ChunkStorage}. */
public class InMemoryChunkStorage implements ChunkStorage {

  private final Map<String, ConcurrentSkipListMap<Integer, byte[]>> chunks = new ConcurrentHashMap<>();

  @Override
  public void put(String fileId, int index, byte[] data) {
    chunks.computeIfAbsent(fileId, id -> new ConcurrentSkipListMap<>()).put(index, data);
  }

  @Override
  public List<byte[]> getAll(String fileId) {
    ConcurrentSkipListMap<Integer, byte[]> pieces = chunks.get(fileId);
    return pieces == null ? List.of() : new ArrayList<>(pieces.values());
  }

  @Override
  public void deleteAll(String fileId) {
    chunks.remove(fileId);
  }
}
