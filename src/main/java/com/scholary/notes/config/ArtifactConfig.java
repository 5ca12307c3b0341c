package com.scholary.notes.config;

import com.scholary.notes.artifact.ArtifactProperties;
import com.scholary.notes.artifact.ArtifactStore;
import com.scholary.notes.artifact.LocalArtifactStore;
import com.scholary.notes.artifact.ObjectStoreArtifactStore;
import com.scholary.notes.objectstore.ObjectStoreClient;
import com.scholary.notes.objectstore.ObjectStoreProperties;
import java.nio.file.Paths;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/** Selects the artifact store backend from {@code artifacts.backend}. */
@Configuration
@EnableConfigurationProperties(ArtifactProperties.class)
public class ArtifactConfig {

  private static final Logger LOGGER = LoggerFactory.getLogger(ArtifactConfig.class);

  @Bean
  public ArtifactStore artifactStore(
      ArtifactProperties properties,
      ObjectStoreClient objectStoreClient,
      ObjectStoreProperties objectStoreProperties) {
    switch (properties.backend()) {
      case ArtifactProperties.LOCAL:
        LOGGER.info("Artifacts stored locally in {}", properties.localDir());
        return new LocalArtifactStore(Paths.get(properties.localDir()));
      case ArtifactProperties.OBJECT_STORE:
        LOGGER.info(
            "Artifacts stored in bucket {} under {}",
            objectStoreProperties.bucket(),
            properties.keyPrefix());
        return new ObjectStoreArtifactStore(
            objectStoreClient, objectStoreProperties.bucket(), properties.keyPrefix());
      default:
        throw new IllegalStateException("Unknown artifacts.backend: " + properties.backend());
    }
  }
}
