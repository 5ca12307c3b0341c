package com.scholary.notes.artifact;

import java.util.Arrays;
import java.util.Optional;

/** Named per-job output files. The stored name is {@code {jobId}{suffix}}. */
public enum ArtifactType {
  TRANSCRIPT("_transcription.txt", "text/plain"),
  EXTRACTED_TEXT("_extracted_text.txt", "text/plain"),
  NOTES_MARKDOWN("_notes.md", "text/markdown"),
  NOTES_TEXT("_notes.txt", "text/plain"),
  TIMESTAMPED_JSON("_timestamped_notes.json", "application/json"),
  TIMESTAMPED_MARKDOWN("_timestamped_notes.md", "text/markdown"),
  NOTES_SRT("_notes.srt", "application/x-subrip"),
  NOTES_VTT("_notes.vtt", "text/vtt");

  private final String suffix;
  private final String contentType;

  ArtifactType(String suffix, String contentType) {
    this.suffix = suffix;
    this.contentType = contentType;
  }

  public String suffix() {
    return suffix;
  }

  public String contentType() {
    return contentType;
  }

  public String fileName(String jobId) {
    return jobId + suffix;
  }

  /** True for the artifacts produced by the alignment stage. */
  public boolean isTimestamped() {
    return this == TIMESTAMPED_JSON
        || this == TIMESTAMPED_MARKDOWN
        || this == NOTES_SRT
        || this == NOTES_VTT;
  }

  /**
   * Look up a type by its enum name, case-insensitively, with dashes accepted for underscores.
   *
   * @param name e.g. "notes-markdown" or "NOTES_MARKDOWN"
   */
  public static Optional<ArtifactType> fromName(String name) {
    if (name == null) {
      return Optional.empty();
    }
    String normalized = name.trim().replace('-', '_');
    return Arrays.stream(values()).filter(t -> t.name().equalsIgnoreCase(normalized)).findFirst();
  }
}
