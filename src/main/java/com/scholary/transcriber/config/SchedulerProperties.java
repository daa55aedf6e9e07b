package com.scholary.transcriber.config;

import jakarta.validation.constraints.Positive;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * Configuration properties for the job scheduler.
 *
 * <p>{@code averageTaskSeconds} only feeds the queue wait estimate; it is not measured.
 */
@ConfigurationProperties(prefix = "scheduler")
@Validated
public record SchedulerProperties(
    @Positive int maxConcurrency,
    @Positive long averageTaskSeconds,
    @Positive int finishedTaskRetentionMinutes,
    @Positive int finishedTaskMaxSize) {}
