package com.scholary.notes.artifact;

import jakarta.validation.constraints.NotBlank;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * Configuration properties for artifact storage.
 *
 * @param backend "local" or "object-store"
 * @param localDir output directory for the local backend
 * @param keyPrefix key prefix for the object-store backend
 */
@ConfigurationProperties(prefix = "artifacts")
@Validated
public record ArtifactProperties(
    @NotBlank String backend, @NotBlank String localDir, @NotBlank String keyPrefix) {

  public static final String LOCAL = "local";
  public static final String OBJECT_STORE = "object-store";
}
