package com.scholary.notes.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.scholary.notes.job.JobJournal;
import com.scholary.notes.job.RegistryProperties;
import java.nio.file.Paths;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/** Configuration for the job registry's journal. */
@Configuration
@EnableConfigurationProperties(RegistryProperties.class)
public class RegistryConfig {

  @Bean
  public JobJournal jobJournal(RegistryProperties properties, ObjectMapper objectMapper) {
    return new JobJournal(Paths.get(properties.journalPath()), objectMapper);
  }
}
