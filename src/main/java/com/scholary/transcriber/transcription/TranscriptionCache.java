package com.scholary.transcriber.transcription;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.scholary.transcriber.config.TranscriptionProperties;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.time.Duration;
import java.util.HexFormat;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

/**
 * Bounded in-memory cache of transcription results using Caffeine.
 *
 * <p>Entries are keyed by a SHA-256 fingerprint of the file identity and the recognition options
 * that change the output. Size is capped and the least recently used entries go first; entries not
 * read for the configured TTL expire.
 *
 * <p>Maintenance runs on the calling thread and during the periodic sweep, never on a pool owned
 * by the cache, so the cache lives and dies with its owner.
 */
@Component
public class TranscriptionCache {

  private static final Logger LOGGER = LoggerFactory.getLogger(TranscriptionCache.class);

  private final Cache<String, TranscriptionResult> cache;
  private final ObjectMapper objectMapper;

  @Autowired
  public TranscriptionCache(TranscriptionProperties properties, ObjectMapper objectMapper) {
    this(properties.cache().maxSize(), Duration.ofMinutes(properties.cache().ttlMinutes()), objectMapper);
  }

  public TranscriptionCache(int maxSize, Duration ttl, ObjectMapper objectMapper) {
    this.objectMapper = objectMapper;
    this.cache =
        Caffeine.newBuilder()
            .maximumSize(maxSize)
            .expireAfterAccess(ttl)
            .executor(Runnable::run)
            .recordStats()
            .build();

    LOGGER.info("Initialized transcription cache: maxSize={}, ttl={}", maxSize, ttl);
  }

  /**
   * Compute the cache key for a request.
   *
   * @param model the model that will actually be used, after defaults are applied
   */
  public String keyFor(AudioSource source, TranscriptionOptions options, String model) {
    Map<String, Object> identity = new LinkedHashMap<>();
    identity.put("name", source.filename());
    identity.put("size", source.size());
    identity.put("lastModified", source.lastModified());
    identity.put("language", options.language());
    identity.put("model", model);
    identity.put("temperature", options.temperature());

    try {
      byte[] canonical = objectMapper.writeValueAsBytes(identity);
      byte[] digest = MessageDigest.getInstance("SHA-256").digest(canonical);
      return HexFormat.of().formatHex(digest);
    } catch (JsonProcessingException | NoSuchAlgorithmException e) {
      throw new IllegalStateException("Failed to compute cache key for " + source.filename(), e);
    }
  }

  public Optional<TranscriptionResult> get(String key) {
    TranscriptionResult result = cache.getIfPresent(key);
    if (result != null) {
      LOGGER.debug("Cache hit: key={}", key);
      return Optional.of(result);
    }
    LOGGER.debug("Cache miss: key={}", key);
    return Optional.empty();
  }

  public void put(String key, TranscriptionResult result) {
    cache.put(key, result);
    LOGGER.debug("Cached transcription: key={}, segments={}", key, result.segments().size());
  }

  /** Run pending evictions and expirations now. */
  public void cleanUp() {
    cache.cleanUp();
  }

  public long size() {
    return cache.estimatedSize();
  }

  /**
   * Get cache statistics for monitoring.
   *
   * @return cache stats
   */
  public String getStats() {
    var stats = cache.stats();
    return String.format(
        "TranscriptionCache[size=%d, hitRate=%.2f%%, evictions=%d]",
        cache.estimatedSize(), stats.hitRate() * 100, stats.evictionCount());
  }
}
