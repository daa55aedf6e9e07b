package com.scholary.transcriber.transcription;

import com.scholary.transcriber.config.TranscriptionProperties;
import com.scholary.transcriber.error.ErrorKind;
import com.scholary.transcriber.error.TranscriberException;
import com.scholary.transcriber.logging.StructuredLogger;
import com.scholary.transcriber.provider.ErrorClassifier;
import com.scholary.transcriber.provider.ProviderProperties;
import com.scholary.transcriber.provider.ProviderRequest;
import com.scholary.transcriber.provider.ProviderResponse;
import com.scholary.transcriber.provider.TranscriptionProvider;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.Callable;
import java.util.concurrent.CancellationException;
import java.util.concurrent.atomic.AtomicLong;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Resilient access to the speech-to-text provider.
 *
 * <p>One {@link #transcribe} call checks the result cache, optimizes the audio, enforces the upload
 * limit, calls the provider once and reconstructs segments. Every failure leaves as a
 * {@link TranscriberException} with a kind, so callers can decide on retries without parsing
 * messages. Retrying is explicit through {@link #executeWithRetry}.
 *
 * <p>The cache key is computed from the file identity and options before anything is sent, so a
 * repeated request never reaches the network.
 */
@Service
public class TranscriptionClient {

  private static final Logger LOGGER = LoggerFactory.getLogger(TranscriptionClient.class);
  private static final StructuredLogger STRUCTURED_LOGGER = new StructuredLogger(LOGGER);

  private final TranscriptionProvider provider;
  private final AudioOptimizer optimizer;
  private final TranscriptionCache cache;
  private final SegmentReconstructor reconstructor;
  private final String defaultModel;
  private final long maxUploadBytes;
  private final RetryPolicy defaultRetryPolicy;

  private final AtomicLong requestCount = new AtomicLong();
  private final AtomicLong errorCount = new AtomicLong();
  private final AtomicLong cacheHits = new AtomicLong();
  private volatile Instant lastUsed;
  private volatile String lastError;

  public TranscriptionClient(
      TranscriptionProvider provider,
      AudioOptimizer optimizer,
      TranscriptionCache cache,
      SegmentReconstructor reconstructor,
      ProviderProperties providerProperties,
      TranscriptionProperties properties) {
    this.provider = provider;
    this.optimizer = optimizer;
    this.cache = cache;
    this.reconstructor = reconstructor;
    this.defaultModel = providerProperties.defaultModel();
    this.maxUploadBytes = properties.optimization().maxUploadBytes();
    this.defaultRetryPolicy = RetryPolicy.from(properties.retry());
  }

  /**
   * Transcribe audio with a single provider attempt.
   *
   * @param source the audio and its identity
   * @param options recognition options
   * @return the transcription, possibly from cache
   * @throws TranscriberException classified failure
   */
  public TranscriptionResult transcribe(AudioSource source, TranscriptionOptions options) {
    requestCount.incrementAndGet();
    lastUsed = Instant.now();

    String model = options.model() != null ? options.model() : defaultModel;
    String cacheKey = cache.keyFor(source, options, model);

    Optional<TranscriptionResult> cached = cache.get(cacheKey);
    if (cached.isPresent()) {
      cacheHits.incrementAndGet();
      LOGGER.info("Returning cached transcription for {}", source.filename());
      options.report(100, "cached");
      return cached.get();
    }

    long start = System.currentTimeMillis();
    try {
      options.report(10, "optimizing");
      AudioSource prepared = optimizer.optimize(source);
      if (prepared.size() > maxUploadBytes) {
        throw new TranscriberException(
            ErrorKind.FILE_TOO_LARGE,
            String.format(
                "Audio %s is %d bytes after optimization, provider limit is %d bytes",
                source.filename(), prepared.size(), maxUploadBytes));
      }

      options.report(30, "transcribing");
      ProviderResponse response =
          provider.transcribe(
              new ProviderRequest(
                  prepared.data(),
                  prepared.filename(),
                  prepared.contentType(),
                  options.language(),
                  model,
                  options.temperature(),
                  options.prompt()));

      options.report(90, "reconstructing");
      List<TranscriptionSegment> segments = reconstructor.reconstruct(response);
      TranscriptionResult result =
          new TranscriptionResult(
              response.text() == null ? "" : response.text().trim(),
              response.language() != null ? response.language() : options.language(),
              resolveDuration(response, segments),
              segments);

      cache.put(cacheKey, result);
      LOGGER.info(
          "Transcribed {}: segments={}, duration={}s, took={}ms",
          source.filename(),
          segments.size(),
          result.duration(),
          System.currentTimeMillis() - start);
      options.report(100, "completed");
      return result;

    } catch (CancellationException e) {
      throw e;
    } catch (RuntimeException e) {
      TranscriberException classified = ErrorClassifier.classify(e);
      errorCount.incrementAndGet();
      lastError = classified.getMessage();
      LOGGER.error(
          "Transcription failed for {}: kind={}, retryable={}, message={}",
          source.filename(),
          classified.getKind(),
          classified.isRetryable(),
          classified.getMessage());
      throw classified;
    }
  }

  /** {@link #transcribe} under the configured retry policy. */
  public TranscriptionResult transcribeWithRetry(AudioSource source, TranscriptionOptions options) {
    return executeWithRetry(() -> transcribe(source, options), defaultRetryPolicy);
  }

  /**
   * Run an operation, retrying retryable failures.
   *
   * <p>Non-retryable failures and the last failure are rethrown classified. Interrupting the
   * calling thread during a backoff ends the loop with a {@link CancellationException}.
   */
  public <T> T executeWithRetry(Callable<T> operation, RetryPolicy policy) {
    for (int attempt = 0; ; attempt++) {
      try {
        return operation.call();
      } catch (CancellationException e) {
        throw e;
      } catch (InterruptedException e) {
        Thread.currentThread().interrupt();
        throw new CancellationException("Operation interrupted");
      } catch (Exception e) {
        TranscriberException classified = ErrorClassifier.classify(e);
        if (!classified.isRetryable() || attempt + 1 >= policy.maxAttempts()) {
          throw classified;
        }

        long delay = Math.max(policy.delayFor(attempt), classified.getRetryAfterMs());
        STRUCTURED_LOGGER.logTranscribeRetry(
            attempt + 1, policy.maxAttempts(), delay, classified.getKind().name(), classified.getMessage());
        try {
          Thread.sleep(delay);
        } catch (InterruptedException ie) {
          Thread.currentThread().interrupt();
          throw new CancellationException("Retry backoff interrupted");
        }
      }
    }
  }

  public RetryPolicy getDefaultRetryPolicy() {
    return defaultRetryPolicy;
  }

  public UsageStats getUsageStats() {
    return new UsageStats(
        requestCount.get(), errorCount.get(), cacheHits.get(), lastUsed, lastError, cache.getStats());
  }

  private static double resolveDuration(ProviderResponse response, List<TranscriptionSegment> segments) {
    if (response.duration() != null) {
      return response.duration();
    }
    return segments.isEmpty() ? 0 : segments.get(segments.size() - 1).end();
  }

  /** Usage counters since the client was created. */
  public record UsageStats(
      long requestCount,
      long errorCount,
      long cacheHits,
      Instant lastUsed,
      String lastError,
      String cacheStats) {}
}
