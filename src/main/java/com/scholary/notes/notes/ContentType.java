package com.scholary.notes.notes;

/** Source of the text handed to the notes generator. Selects prompt wording and headers. */
public enum ContentType {
  VIDEO("video transcription", "# Complete Course Notes"),
  DOCUMENT("PDF document", "# Complete Document Notes");

  private final String description;
  private final String combinedHeader;

  ContentType(String description, String combinedHeader) {
    this.description = description;
    this.combinedHeader = combinedHeader;
  }

  public String description() {
    return description;
  }

  /** Title placed above notes stitched together from several chunks. */
  public String combinedHeader() {
    return combinedHeader;
  }
}
