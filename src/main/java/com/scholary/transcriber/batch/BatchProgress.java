package com.scholary.transcriber.batch;

/**
 * Progress snapshot published while a run is in flight.
 *
 * @param processed items whose batch has finished, successfully or not
 * @param total items in the run
 * @param percentage {@code processed * 100 / total}, 100 for an empty run
 * @param currentBatch one-based index of the most recent batch
 * @param totalBatches number of batches in the run
 * @param status run status
 * @param message optional human-readable detail
 * @param error message of the failure that triggered this event, if any
 */
public record BatchProgress(
    int processed,
    int total,
    int percentage,
    int currentBatch,
    int totalBatches,
    BatchStatus status,
    String message,
    String error) {

  static BatchProgress of(
      int processed, int total, int currentBatch, int totalBatches, BatchStatus status, String message) {
    return new BatchProgress(
        processed, total, percentage(processed, total), currentBatch, totalBatches, status, message, null);
  }

  static BatchProgress failure(
      int processed, int total, int currentBatch, int totalBatches, BatchStatus status, String error) {
    return new BatchProgress(
        processed, total, percentage(processed, total), currentBatch, totalBatches, status, null, error);
  }

  private static int percentage(int processed, int total) {
    return total == 0 ? 100 : (int) Math.round(processed * 100.0 / total);
  }
}
