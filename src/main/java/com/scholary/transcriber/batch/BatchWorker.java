package com.scholary.transcriber.batch;

import java.util.List;

/**
 * Processes one batch.
 *
 * <p>Implementations must return results in the order of {@code batch}. Throwing marks the attempt
 * as failed; a non-retryable {@link com.scholary.transcriber.error.TranscriberException} stops the
 * retries for that batch.
 */
@FunctionalInterface
public interface BatchWorker<T, R> {

  List<R> process(List<T> batch, int batchIndex) throws Exception;
}
