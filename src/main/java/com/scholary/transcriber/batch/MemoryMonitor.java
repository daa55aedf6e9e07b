package com.scholary.transcriber.batch;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Heap usage gauge consulted before each batch attempt.
 *
 * <p>Attempts made while usage is above the configured threshold fail fast instead of allocating
 * more memory, and are retried after the usual backoff.
 */
@Component
public class MemoryMonitor {

  private static final Logger LOGGER = LoggerFactory.getLogger(MemoryMonitor.class);

  // Above this ratio a GC is suggested before reporting
  private static final double CRITICAL_RATIO = 0.85;

  /**
   * Check whether heap usage is below a threshold.
   *
   * @param thresholdPercent limit in percent of max heap
   * @return true if it is safe to start more work
   */
  public boolean isMemoryUsageSafe(double thresholdPercent) {
    double usage = getMemoryUsageRatio();

    if (usage >= CRITICAL_RATIO) {
      LOGGER.warn("Memory usage high ({}%), suggesting GC", String.format("%.1f", usage * 100));
      System.gc(); // Not guaranteed to run
      usage = getMemoryUsageRatio();
    }

    boolean safe = usage * 100 < thresholdPercent;
    if (!safe) {
      LOGGER.warn(
          "Memory usage {}% is above threshold {}%: {}",
          String.format("%.1f", usage * 100),
          thresholdPercent,
          getMemoryStats());
    }
    return safe;
  }

  /**
   * Get current memory usage ratio (0.0 to 1.0).
   *
   * @return memory usage ratio
   */
  public double getMemoryUsageRatio() {
    Runtime runtime = Runtime.getRuntime();
    long usedMemory = runtime.totalMemory() - runtime.freeMemory();
    return (double) usedMemory / runtime.maxMemory();
  }

  /**
   * Get memory statistics for logging.
   *
   * @return formatted memory statistics
   */
  public String getMemoryStats() {
    Runtime runtime = Runtime.getRuntime();
    long maxMemory = runtime.maxMemory();
    long totalMemory = runtime.totalMemory();
    long usedMemory = totalMemory - runtime.freeMemory();

    return String.format(
        "Memory[used=%dMB, total=%dMB, max=%dMB, usage=%.1f%%]",
        usedMemory / 1024 / 1024,
        totalMemory / 1024 / 1024,
        maxMemory / 1024 / 1024,
        (double) usedMemory / maxMemory * 100);
  }
}
