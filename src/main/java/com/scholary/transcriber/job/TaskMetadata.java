package com.scholary.transcriber.job;

/**
 * Descriptive data about the file behind a task.
 *
 * @param duration seconds, null when unknown
 * @param language expected language, null for auto-detection
 */
public record TaskMetadata(String filename, long size, Double duration, String format, String language) {}
