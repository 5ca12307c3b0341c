package com.scholary.notes.alignment;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Splits a markdown notes document into sections at ATX headings.
 *
 * <p>Lines are trimmed and blank lines dropped. Text before the first heading belongs to no
 * section and is ignored.
 */
public final class NoteSectionParser {

  private static final Pattern HEADING = Pattern.compile("^(#{1,6})\\s+(.+)$");

  private NoteSectionParser() {}

  public static List<NoteSection> parse(String notes) {
    List<NoteSection> sections = new ArrayList<>();
    if (notes == null || notes.isBlank()) {
      return sections;
    }

    String title = null;
    int level = 0;
    StringBuilder content = new StringBuilder();

    for (String rawLine : notes.split("\\R")) {
      String line = rawLine.trim();
      if (line.isEmpty()) {
        continue;
      }

      Matcher heading = HEADING.matcher(line);
      if (heading.matches()) {
        if (title != null) {
          sections.add(toSection(title, content, level));
        }
        title = heading.group(2).trim();
        level = heading.group(1).length();
        content.setLength(0);
      } else if (title != null) {
        content.append(line).append('\n');
      }
    }

    if (title != null) {
      sections.add(toSection(title, content, level));
    }
    return sections;
  }

  private static NoteSection toSection(String title, StringBuilder content, int level) {
    String body = content.toString().strip();
    SectionKind kind = body.isEmpty() ? SectionKind.TITLE_ONLY : SectionKind.CONTENT;
    return new NoteSection(title, body, level, kind);
  }
}
