package com.scholary.transcriber.batch;

import com.scholary.transcriber.config.BatchProperties;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

/**
 * Creates {@link BatchExecutor} instances from the configured defaults.
 *
 * <p>Executors are cheap and hold per-run state (history, listeners), so callers create one per
 * purpose rather than sharing a single instance.
 */
@Component
public class BatchExecutors {

  private final BatchConfig defaults;
  private final MemoryMonitor memoryMonitor;

  @Autowired
  public BatchExecutors(BatchProperties properties, MemoryMonitor memoryMonitor) {
    this(properties.toConfig(), memoryMonitor);
  }

  public BatchExecutors(BatchConfig defaults, MemoryMonitor memoryMonitor) {
    this.defaults = defaults;
    this.memoryMonitor = memoryMonitor;
  }

  public <T, R> BatchExecutor<T, R> create() {
    return new BatchExecutor<>(defaults, memoryMonitor);
  }

  public <T, R> BatchExecutor<T, R> create(BatchConfig config) {
    return new BatchExecutor<>(config, memoryMonitor);
  }

  /** Preset for store writes: batches of 50, one at a time. */
  public <T, R> BatchExecutor<T, R> forDatabase() {
    return new BatchExecutor<>(defaults.forDatabase(), memoryMonitor);
  }

  /** Preset sized to the workload. */
  public <T, R> BatchExecutor<T, R> forItemCount(int itemCount) {
    return new BatchExecutor<>(defaults.forItemCount(itemCount), memoryMonitor);
  }

  public BatchConfig getDefaults() {
    return defaults;
  }
}
