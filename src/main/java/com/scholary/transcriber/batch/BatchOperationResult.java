package com.scholary.transcriber.batch;

import java.util.List;

/**
 * Outcome of {@link BatchExecutor#process}.
 *
 * <p>{@code results} holds the output of every successful batch in batch order. {@code success} is
 * false as soon as one batch failed; the results of the others are still returned.
 */
public record BatchOperationResult<R>(
    boolean success,
    List<R> results,
    List<BatchError> errors,
    BatchPerformance performance,
    int processedItems,
    int totalItems) {

  public BatchOperationResult {
    results = List.copyOf(results);
    errors = List.copyOf(errors);
  }

  public boolean hasErrors() {
    return !errors.isEmpty();
  }
}
