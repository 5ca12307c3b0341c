package com.scholary.notes.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.scholary.notes.transcription.TranscriptionService;
import com.scholary.notes.transcription.WhisperClient;
import com.scholary.notes.transcription.WhisperProperties;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Configuration for the transcription service.
 *
 * <p>Enables the WhisperProperties to be loaded from application.yml.
 */
@Configuration
@EnableConfigurationProperties(WhisperProperties.class)
public class TranscriptionConfig {

  @Bean
  public TranscriptionService transcriptionService(
      WhisperProperties properties, ObjectMapper objectMapper) {
    return new WhisperClient(properties, objectMapper);
  }
}
