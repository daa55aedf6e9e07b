package com.scholary.transcriber.transcription;

import com.scholary.transcriber.config.TranscriptionProperties;
import java.time.Duration;
import java.util.concurrent.ScheduledFuture;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.SmartLifecycle;
import org.springframework.scheduling.concurrent.ThreadPoolTaskScheduler;
import org.springframework.stereotype.Component;

/**
 * Periodic sweep of the transcription cache.
 *
 * <p>Owned by the application lifecycle: the sweep starts with the context and its scheduler is
 * shut down with it, so no timer outlives the cache.
 */
@Component
public class CacheMaintenance implements SmartLifecycle {

  private static final Logger LOGGER = LoggerFactory.getLogger(CacheMaintenance.class);

  private final TranscriptionCache cache;
  private final Duration interval;
  private ThreadPoolTaskScheduler scheduler;
  private ScheduledFuture<?> sweep;

  public CacheMaintenance(TranscriptionCache cache, TranscriptionProperties properties) {
    this.cache = cache;
    this.interval = Duration.ofSeconds(properties.cache().sweepIntervalSeconds());
  }

  @Override
  public synchronized void start() {
    if (isRunning()) {
      return;
    }
    scheduler = new ThreadPoolTaskScheduler();
    scheduler.setPoolSize(1);
    scheduler.setThreadNamePrefix("cache-sweep-");
    scheduler.initialize();
    sweep = scheduler.scheduleAtFixedRate(this::sweepOnce, interval);
    LOGGER.info("Started transcription cache sweep every {}", interval);
  }

  @Override
  public synchronized void stop() {
    if (sweep != null) {
      sweep.cancel(false);
      sweep = null;
    }
    if (scheduler != null) {
      scheduler.shutdown();
      scheduler = null;
    }
    LOGGER.info("Stopped transcription cache sweep");
  }

  @Override
  public synchronized boolean isRunning() {
    return sweep != null;
  }

  void sweepOnce() {
    cache.cleanUp();
    LOGGER.debug("Cache sweep finished: {}", cache.getStats());
  }
}
