package com.scholary.notes.artifact;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/** Stores artifacts as flat files in one output directory. */
public class LocalArtifactStore implements ArtifactStore {

  private static final Logger LOGGER = LoggerFactory.getLogger(LocalArtifactStore.class);

  private final Path outputDir;

  public LocalArtifactStore(Path outputDir) {
    this.outputDir = outputDir;
  }

  @Override
  public void write(String jobId, ArtifactType type, String content) {
    Path file = resolve(jobId, type);
    try {
      Files.createDirectories(outputDir);
      Files.writeString(file, content, StandardCharsets.UTF_8);
      LOGGER.debug("Wrote artifact: {}", file);
    } catch (IOException e) {
      throw new UncheckedIOException("Failed to write artifact " + file, e);
    }
  }

  @Override
  public Optional<String> read(String jobId, ArtifactType type) {
    Path file = resolve(jobId, type);
    if (!Files.isRegularFile(file)) {
      return Optional.empty();
    }
    try {
      return Optional.of(Files.readString(file, StandardCharsets.UTF_8));
    } catch (IOException e) {
      throw new UncheckedIOException("Failed to read artifact " + file, e);
    }
  }

  @Override
  public boolean exists(String jobId, ArtifactType type) {
    return Files.isRegularFile(resolve(jobId, type));
  }

  private Path resolve(String jobId, ArtifactType type) {
    Path file = outputDir.resolve(type.fileName(jobId)).normalize();
    if (!file.startsWith(outputDir.normalize())) {
      throw new IllegalArgumentException("Invalid job id: " + jobId);
    }
    return file;
  }
}
