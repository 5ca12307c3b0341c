package com.scholary.notes.pipeline;

import java.nio.file.Path;
import java.util.Objects;

/**
 * Where a job's input comes from: a file already on local disk, or an object in the store.
 *
 * <p>Local files are uploads the caller staged for this job and are removed with the job's other
 * temporary files.
 */
public record PipelineInput(InputKind kind, Path localFile, String bucket, String key) {

  public PipelineInput {
    Objects.requireNonNull(kind, "kind");
    if ((localFile == null) == (key == null)) {
      throw new IllegalArgumentException("Exactly one of localFile or bucket/key must be given");
    }
  }

  public static PipelineInput localFile(InputKind kind, Path file) {
    return new PipelineInput(kind, file, null, null);
  }

  public static PipelineInput storedObject(InputKind kind, String bucket, String key) {
    Objects.requireNonNull(bucket, "bucket");
    return new PipelineInput(kind, null, bucket, key);
  }

  public boolean isStoredObject() {
    return key != null;
  }

  /** File name extension including the dot, or an empty string. */
  public String extension() {
    String name = isStoredObject() ? key : localFile.getFileName().toString();
    int slash = name.lastIndexOf('/');
    int dot = name.lastIndexOf('.');
    return dot > slash && dot < name.length() - 1 ? name.substring(dot) : "";
  }

  @Override
  public String toString() {
    return isStoredObject()
        ? String.format("%s[%s/%s]", kind, bucket, key)
        : String.format("%s[%s]", kind, localFile);
  }
}
