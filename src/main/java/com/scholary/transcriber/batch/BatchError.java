package com.scholary.transcriber.batch;

/**
 * A batch that exhausted its attempts.
 *
 * @param batchIndex zero-based batch index
 * @param itemCount items in the failed batch
 * @param attempts attempts made, including the first
 * @param message failure message
 * @param cause the last failure
 */
public record BatchError(int batchIndex, int itemCount, int attempts, String message, Throwable cause) {}
