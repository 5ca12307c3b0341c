package com.scholary.notes.artifact;

import com.scholary.notes.objectstore.ObjectStoreClient;
import com.scholary.notes.objectstore.ObjectStoreException;
import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.util.Optional;

/**
 * Stores artifacts in the object store under {@code {keyPrefix}/{jobId}/{fileName}}.
 */
public class ObjectStoreArtifactStore implements ArtifactStore {

  private final ObjectStoreClient client;
  private final String bucket;
  private final String keyPrefix;

  public ObjectStoreArtifactStore(ObjectStoreClient client, String bucket, String keyPrefix) {
    this.client = client;
    this.bucket = bucket;
    this.keyPrefix = keyPrefix;
  }

  @Override
  public void write(String jobId, ArtifactType type, String content) {
    byte[] bytes = content.getBytes(StandardCharsets.UTF_8);
    client.putObject(
        bucket,
        key(jobId, type),
        new ByteArrayInputStream(bytes),
        bytes.length,
        type.contentType() + "; charset=utf-8");
  }

  @Override
  public Optional<String> read(String jobId, ArtifactType type) {
    String key = key(jobId, type);
    if (!client.objectExists(bucket, key)) {
      return Optional.empty();
    }
    try (InputStream in = client.getObjectStream(bucket, key)) {
      return Optional.of(new String(in.readAllBytes(), StandardCharsets.UTF_8));
    } catch (IOException e) {
      throw new UncheckedIOException("Failed to read artifact " + key, e);
    }
  }

  @Override
  public boolean exists(String jobId, ArtifactType type) {
    return client.objectExists(bucket, key(jobId, type));
  }

  String key(String jobId, ArtifactType type) {
    if (jobId.contains("/")) {
      throw new ObjectStoreException("Invalid job id: " + jobId);
    }
    return keyPrefix + "/" + jobId + "/" + type.fileName(jobId);
  }
}
