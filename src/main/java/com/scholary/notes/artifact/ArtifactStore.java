package com.scholary.notes.artifact;

import java.util.Optional;

/**
 * Durable storage for per-job output artifacts.
 *
 * <p>Implementations throw {@link java.io.UncheckedIOException} or an object-store exception on
 * write failures; the caller decides whether that is fatal.
 */
public interface ArtifactStore {

  void write(String jobId, ArtifactType type, String content);

  Optional<String> read(String jobId, ArtifactType type);

  boolean exists(String jobId, ArtifactType type);

  /** True if any known artifact exists for the job. */
  default boolean existsAny(String jobId) {
    for (ArtifactType type : ArtifactType.values()) {
      if (exists(jobId, type)) {
        return true;
      }
    }
    return false;
  }
}
