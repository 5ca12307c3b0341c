package com.scholary.notes.notes;

/** Prompt text for the chat completion API. */
final class NotesPrompts {

  static final String SYSTEM_PROMPT =
      "You are an expert AI learning assistant helping students learn complex material"
          + " efficiently through bite-sized, focused notes.";

  private NotesPrompts() {}

  static String single(String content, ContentType type) {
    return instructions(type) + "\nContent to process:\n" + content + "\n\nGenerate the notes:";
  }

  static String sequential(String content, ContentType type, int part, int totalParts) {
    return "This is part "
        + part
        + " of "
        + totalParts
        + " sequential sections from the same content. Keep the source order and do not repeat"
        + " material from earlier parts.\n\n"
        + single(content, type);
  }

  private static String instructions(ContentType type) {
    return "You are processing a "
        + type.description()
        + ". Create structured learning notes that follow the order of the source.\n\n"
        + "Instructions:\n"
        + "- Use ## for main concepts and ### for sub-topics\n"
        + "- Every heading must be followed by a short explanation of 50-60 words\n"
        + "- Prefer the speaker's or author's own terminology\n"
        + "- Include one concrete example where the source gives one\n"
        + "- Put exact definitions in double quotes\n";
  }
}
