package com.scholary.transcriber.config;

import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Configuration;

/**
 * Configuration for pipeline settings.
 *
 * <p>Enables the transcription, batch and scheduler properties to be loaded from application.yml.
 */
@Configuration
@EnableConfigurationProperties({
  TranscriptionProperties.class,
  BatchProperties.class,
  SchedulerProperties.class
})
public class TranscriptionConfig {}
