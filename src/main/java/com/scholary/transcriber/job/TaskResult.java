package com.scholary.transcriber.job;

/**
 * What a completed task produced.
 *
 * @param transcriptId id of the persisted transcript
 * @param partial true when some chunks failed and the transcript has gaps
 * @param failedChunks number of chunks without a transcription
 */
public record TaskResult(
    String transcriptId,
    String text,
    String language,
    double duration,
    int segmentCount,
    boolean partial,
    int failedChunks) {}
