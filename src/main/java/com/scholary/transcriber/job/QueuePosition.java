package com.scholary.transcriber.job;

/**
 * Where a queued task stands.
 *
 * @param position zero-based index in the ordered queue
 * @param tasksAhead queued tasks that will be dispatched first
 * @param estimatedWaitSeconds rough wait until dispatch
 */
public record QueuePosition(int position, int tasksAhead, long estimatedWaitSeconds) {}
