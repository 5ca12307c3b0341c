package com.scholary.notes.alignment;

/** Whether a note section has a body under its heading. */
public enum SectionKind {
  TITLE_ONLY,
  CONTENT
}
