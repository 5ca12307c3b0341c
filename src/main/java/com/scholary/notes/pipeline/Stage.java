package com.scholary.notes.pipeline;

/** Pipeline stages in execution order, with the progress text shown while each runs. */
public enum Stage {
  ACQUIRE("Acquiring input..."),
  EXTRACT("Extracting audio..."),
  TRANSCRIBE("Transcribing audio..."),
  GENERATE_NOTES("Generating structured learning notes..."),
  ALIGN("Mapping notes to audio timestamps..."),
  PERSIST("Saving results..."),
  CHARGE("Processing payment...");

  private final String progress;

  Stage(String progress) {
    this.progress = progress;
  }

  public String progressFor(InputKind kind) {
    if (this == EXTRACT && kind == InputKind.DOCUMENT) {
      return "Extracting text from PDF...";
    }
    return progress;
  }
}
