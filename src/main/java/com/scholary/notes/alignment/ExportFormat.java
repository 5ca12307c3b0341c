package com.scholary.notes.alignment;

/** Renderings of a {@link TimestampMapping}. */
public enum ExportFormat {
  JSON,
  MARKDOWN,
  SRT,
  VTT
}
