package com.scholary.transcriber.batch;

import com.scholary.transcriber.error.TranscriberException;
import com.scholary.transcriber.event.ProgressFeed;
import com.scholary.transcriber.logging.StructuredLogger;
import java.time.Instant;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ThreadLocalRandom;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.scheduling.concurrent.CustomizableThreadFactory;

/**
 * Runs a list of items through a worker in fixed-size batches with bounded concurrency.
 *
 * <p>Batches are formed in input order. Up to {@code maxConcurrentBatches} of them run at once, as
 * a group; progress is published after every group. Each batch is retried on its own with
 * exponential backoff, {@code min(retryDelay * 2^(attempt-1), maxRetryDelay)}, and a batch that
 * runs out of attempts is reported as one {@link BatchError} while its siblings carry on.
 *
 * <p>A {@link TranscriberException} that suggests a longer wait (a provider rate limit) stretches
 * the delay to that suggestion.
 *
 * <p>Before every attempt the heap gauge is consulted. Above the threshold the attempt fails
 * without calling the worker and goes through the normal retry path.
 *
 * <p>Interrupting the calling thread cancels the run: in-flight batches are interrupted and no
 * further retries are scheduled.
 *
 * @param <T> input item type
 * @param <R> result item type
 */
public class BatchExecutor<T, R> {

  private static final Logger LOGGER = LoggerFactory.getLogger(BatchExecutor.class);
  private static final StructuredLogger STRUCTURED_LOGGER = new StructuredLogger(LOGGER);

  private final BatchConfig config;
  private final MemoryMonitor memoryMonitor;
  private final ProgressFeed<BatchProgress> progressFeed = new ProgressFeed<>();
  private final Deque<BatchRunSummary> history = new ArrayDeque<>();

  public BatchExecutor(BatchConfig config, MemoryMonitor memoryMonitor) {
    List<String> errors = config.validate();
    if (!errors.isEmpty()) {
      throw new IllegalArgumentException("Invalid batch configuration: " + String.join("; ", errors));
    }
    this.config = config;
    this.memoryMonitor = memoryMonitor;
  }

  public BatchConfig getConfig() {
    return config;
  }

  /** Progress events of every run made by this executor. */
  public ProgressFeed<BatchProgress> progress() {
    return progressFeed;
  }

  /**
   * Process all items.
   *
   * @param items input items; an empty list returns a successful empty result immediately
   * @param worker processes one batch
   * @return results of the successful batches in batch order plus one error per failed batch
   */
  public BatchOperationResult<R> process(List<T> items, BatchWorker<T, R> worker) {
    long startNanos = System.nanoTime();
    Instant startedAt = Instant.now();

    if (items.isEmpty()) {
      publish(BatchProgress.of(0, 0, 0, 0, BatchStatus.COMPLETED, "Nothing to process"));
      return new BatchOperationResult<>(
          true, List.of(), List.of(), new BatchPerformance(0, 0, 0), 0, 0);
    }

    List<List<T>> batches = partition(items, config.batchSize());
    int totalItems = items.size();
    int totalBatches = batches.size();
    RunState state = new RunState(totalItems, totalBatches);

    LOGGER.info(
        "Starting batch run: items={}, batches={}, batchSize={}, concurrency={}",
        totalItems,
        totalBatches,
        config.batchSize(),
        config.maxConcurrentBatches());
    publish(BatchProgress.of(0, totalItems, 0, totalBatches, BatchStatus.STARTED, null));

    List<BatchOutcome<R>> outcomes = new ArrayList<>(totalBatches);

    ExecutorService pool =
        Executors.newFixedThreadPool(
            Math.min(config.maxConcurrentBatches(), totalBatches),
            new CustomizableThreadFactory("batch-"));
    try {
      for (int groupStart = 0; groupStart < totalBatches; groupStart += config.maxConcurrentBatches()) {
        int groupEnd = Math.min(groupStart + config.maxConcurrentBatches(), totalBatches);
        List<CompletableFuture<BatchOutcome<R>>> group = new ArrayList<>();

        for (int batchIndex = groupStart; batchIndex < groupEnd; batchIndex++) {
          List<T> batch = batches.get(batchIndex);
          int index = batchIndex;
          group.add(
              CompletableFuture.supplyAsync(
                  () -> runBatch(batch, index, worker, state),
                  pool));
        }

        for (CompletableFuture<BatchOutcome<R>> future : group) {
          BatchOutcome<R> outcome = await(future);
          outcomes.add(outcome);
          state.processed.addAndGet(outcome.itemCount());
        }

        publish(
            BatchProgress.of(
                state.processed.get(),
                totalItems,
                groupEnd,
                totalBatches,
                BatchStatus.PROCESSING,
                String.format("Finished batches %d-%d of %d", groupStart + 1, groupEnd, totalBatches)));
      }
    } finally {
      pool.shutdownNow();
    }

    List<R> results = new ArrayList<>();
    List<BatchError> errors = new ArrayList<>();
    int processedItems = 0;
    for (BatchOutcome<R> outcome : outcomes) {
      if (outcome.error() == null) {
        results.addAll(outcome.results());
        processedItems += outcome.itemCount();
      } else {
        errors.add(outcome.error());
      }
    }

    long durationMs = (System.nanoTime() - startNanos) / 1_000_000;
    BatchPerformance performance =
        new BatchPerformance(
            durationMs, state.retryCount.get(), state.batchTimeNanos.get() / 1_000_000 / totalBatches);
    boolean success = errors.isEmpty();

    if (success) {
      publish(BatchProgress.of(totalItems, totalItems, totalBatches, totalBatches, BatchStatus.COMPLETED, null));
      LOGGER.info(
          "Batch run completed: items={}, duration={}ms, retries={}",
          totalItems,
          durationMs,
          state.retryCount.get());
    } else {
      publish(
          BatchProgress.failure(
              state.processed.get(),
              totalItems,
              totalBatches,
              totalBatches,
              BatchStatus.FAILED,
              errors.size() + " of " + totalBatches + " batches failed"));
      LOGGER.warn(
          "Batch run finished with failures: failedBatches={}/{}, processedItems={}/{}",
          errors.size(),
          totalBatches,
          processedItems,
          totalItems);
    }

    recordRun(
        new BatchRunSummary(
            startedAt, durationMs, totalItems, totalBatches, success, state.retryCount.get()));
    return new BatchOperationResult<>(success, results, errors, performance, processedItems, totalItems);
  }

  /** Snapshot of the sampled run history, oldest first. */
  public List<BatchRunSummary> getHistory() {
    synchronized (history) {
      return List.copyOf(history);
    }
  }

  /** Delay before the retry that follows {@code attempt}. Attempts are one-based. */
  long retryDelay(int attempt) {
    double delay = config.retryDelayMs() * Math.pow(2, attempt - 1);
    return (long) Math.min(delay, config.maxRetryDelayMs());
  }

  private BatchOutcome<R> runBatch(
      List<T> batch, int batchIndex, BatchWorker<T, R> worker, RunState state) {
    long start = System.nanoTime();
    int maxAttempts = config.maxRetries() + 1;
    Exception lastException = null;
    int attempt = 0;

    try {
      while (attempt < maxAttempts) {
        attempt++;
        if (Thread.currentThread().isInterrupted()) {
          lastException = new CancellationException("Batch " + batchIndex + " cancelled");
          break;
        }
        try {
          if (!memoryMonitor.isMemoryUsageSafe(config.memoryThresholdPercent())) {
            throw new IllegalStateException(
                "Memory usage above " + config.memoryThresholdPercent() + "% threshold");
          }
          List<R> results = worker.process(batch, batchIndex);
          return new BatchOutcome<>(batch.size(), results, null);
        } catch (InterruptedException | CancellationException e) {
          Thread.currentThread().interrupt();
          lastException = e;
          break;
        } catch (Exception e) {
          lastException = e;
          if (!isRetryable(e) || attempt >= maxAttempts) {
            break;
          }

          long delay = Math.max(retryDelay(attempt), suggestedDelay(e));
          state.retryCount.incrementAndGet();
          STRUCTURED_LOGGER.logBatchRetry(
              batchIndex, attempt, config.maxRetries(), delay, errorType(e), e.getMessage());
          publish(
              BatchProgress.failure(
                  state.processed.get(),
                  state.totalItems,
                  batchIndex + 1,
                  state.totalBatches,
                  BatchStatus.RETRYING,
                  e.getMessage()));
          try {
            Thread.sleep(delay);
          } catch (InterruptedException ie) {
            Thread.currentThread().interrupt();
            lastException = ie;
            break;
          }
        }
      }
    } finally {
      state.batchTimeNanos.addAndGet(System.nanoTime() - start);
    }

    String message =
        lastException == null ? "Batch " + batchIndex + " failed" : lastException.getMessage();
    STRUCTURED_LOGGER.logBatchFailed(batchIndex, attempt, errorType(lastException), message);
    return new BatchOutcome<>(
        batch.size(),
        List.of(),
        new BatchError(batchIndex, batch.size(), attempt, message, lastException));
  }

  private BatchOutcome<R> await(CompletableFuture<BatchOutcome<R>> future) {
    try {
      return future.get();
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      throw new CancellationException("Batch run interrupted");
    } catch (ExecutionException | CompletionException e) {
      // runBatch captures worker failures, so this is a bug in the executor itself
      throw new IllegalStateException("Batch execution failed unexpectedly", e.getCause());
    }
  }

  private static boolean isRetryable(Exception e) {
    if (e instanceof TranscriberException) {
      return ((TranscriberException) e).isRetryable();
    }
    return true;
  }

  private static long suggestedDelay(Exception e) {
    if (e instanceof TranscriberException) {
      return ((TranscriberException) e).getRetryAfterMs();
    }
    return 0;
  }

  private static String errorType(Exception e) {
    if (e == null) {
      return "unknown";
    }
    if (e instanceof TranscriberException) {
      return ((TranscriberException) e).getKind().name();
    }
    return e.getClass().getSimpleName();
  }

  private void publish(BatchProgress progress) {
    if (config.progressTracking()) {
      progressFeed.publish(progress);
    }
  }

  private void recordRun(BatchRunSummary summary) {
    if (ThreadLocalRandom.current().nextDouble() >= config.samplingRate()) {
      return;
    }
    synchronized (history) {
      history.addLast(summary);
      while (history.size() > config.maxHistorySize()) {
        history.removeFirst();
      }
    }
  }

  private static <T> List<List<T>> partition(List<T> items, int size) {
    List<List<T>> batches = new ArrayList<>();
    for (int i = 0; i < items.size(); i += size) {
      batches.add(List.copyOf(items.subList(i, Math.min(i + size, items.size()))));
    }
    return batches;
  }

  private record BatchOutcome<R>(int itemCount, List<R> results, BatchError error) {}

  /** Counters shared by the batches of one run. */
  private static final class RunState {
    private final int totalItems;
    private final int totalBatches;
    private final AtomicInteger processed = new AtomicInteger();
    private final AtomicInteger retryCount = new AtomicInteger();
    private final AtomicLong batchTimeNanos = new AtomicLong();

    private RunState(int totalItems, int totalBatches) {
      this.totalItems = totalItems;
      this.totalBatches = totalBatches;
    }
  }
}
