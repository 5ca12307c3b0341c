package com.scholary.notes.config;

import com.scholary.notes.alignment.AlignmentProperties;
import com.scholary.notes.credit.CreditProperties;
import com.scholary.notes.media.MediaProperties;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.Clock;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Configuration for the processing pipeline.
 *
 * <p>Enables the pipeline, alignment, media and credit properties and makes sure the temp
 * directory exists before the first job arrives.
 */
@Configuration
@EnableConfigurationProperties({
  PipelineProperties.class,
  AlignmentProperties.class,
  MediaProperties.class,
  CreditProperties.class
})
public class PipelineConfig {

  private static final Logger LOGGER = LoggerFactory.getLogger(PipelineConfig.class);

  public PipelineConfig(PipelineProperties properties) {
    Path tempDir = Paths.get(properties.tempDir());
    try {
      Files.createDirectories(tempDir);
    } catch (IOException e) {
      throw new UncheckedIOException("Failed to create temp directory: " + tempDir, e);
    }
    LOGGER.info("Pipeline temp directory: {}", tempDir.toAbsolutePath());
  }

  @Bean
  public Clock clock() {
    return Clock.systemUTC();
  }
}
