package com.scholary.notes.notes;

import java.util.Optional;

/** Turns transcript or document text into heading-delimited markdown notes. */
public interface NotesGenerator {

  /**
   * Generate structured notes.
   *
   * @param content transcript text or extracted document text
   * @param type where the content came from
   * @return the notes, or empty when generation is disabled, the content is too short, or the
   *     upstream service failed
   */
  Optional<String> generateNotes(String content, ContentType type);
}
