package com.scholary.notes.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.scholary.notes.notes.ChatCompletionNotesGenerator;
import com.scholary.notes.notes.GeneratedNotesTracker;
import com.scholary.notes.notes.NotesGenerator;
import com.scholary.notes.notes.NotesProperties;
import com.scholary.notes.notes.RequestThrottle;
import java.net.http.HttpClient;
import java.time.Duration;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Configuration for notes generation.
 *
 * <p>The throttle and the duplicate tracker are shared by all jobs, so calls to the completion
 * API are spaced out across the whole process.
 */
@Configuration
@EnableConfigurationProperties(NotesProperties.class)
public class NotesConfig {

  @Bean
  public RequestThrottle notesRequestThrottle(NotesProperties properties) {
    return new RequestThrottle(Duration.ofMillis(properties.minRequestIntervalMillis()));
  }

  @Bean
  public GeneratedNotesTracker generatedNotesTracker(NotesProperties properties) {
    return new GeneratedNotesTracker(
        properties.trackerMaxSize(), Duration.ofHours(properties.trackerExpireHours()));
  }

  @Bean
  public NotesGenerator notesGenerator(
      NotesProperties properties,
      ObjectMapper objectMapper,
      RequestThrottle notesRequestThrottle,
      GeneratedNotesTracker generatedNotesTracker) {
    HttpClient httpClient =
        HttpClient.newBuilder()
            .connectTimeout(Duration.ofSeconds(properties.connectTimeout()))
            .build();
    return new ChatCompletionNotesGenerator(
        properties, objectMapper, notesRequestThrottle, generatedNotesTracker, httpClient);
  }
}
