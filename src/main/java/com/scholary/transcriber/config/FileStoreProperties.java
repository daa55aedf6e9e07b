package com.scholary.transcriber.config;

import jakarta.validation.constraints.Positive;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * Configuration properties for file storage.
 *
 * <p>Files larger than {@code storageChunkThresholdBytes} are stored as pieces of
 * {@code storageChunkSizeBytes}.
 */
@ConfigurationProperties(prefix = "filestore")
@Validated
public record FileStoreProperties(
    @Positive long storageChunkThresholdBytes, @Positive int storageChunkSizeBytes) {}
