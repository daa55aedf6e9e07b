package com.scholary.transcriber.batch;

/** Lifecycle of a batch run as seen by progress listeners. */
public enum BatchStatus {
  STARTED,
  PROCESSING,
  RETRYING,
  COMPLETED,
  FAILED
}
