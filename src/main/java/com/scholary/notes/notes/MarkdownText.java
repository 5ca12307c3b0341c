package com.scholary.notes.notes;

import java.util.regex.Pattern;

/** Converts generated markdown notes to plain text. */
public final class MarkdownText {

  private static final Pattern HEADER = Pattern.compile("(?m)^#{1,6}\\s+");
  private static final Pattern BOLD_STARS = Pattern.compile("\\*\\*([^*]+)\\*\\*");
  private static final Pattern ITALIC_STAR = Pattern.compile("\\*([^*]+)\\*");
  private static final Pattern BOLD_UNDERSCORES = Pattern.compile("__([^_]+)__");
  private static final Pattern ITALIC_UNDERSCORE = Pattern.compile("_([^_]+)_");
  private static final Pattern CODE_BLOCK = Pattern.compile("(?s)```[^`]*```");
  private static final Pattern INLINE_CODE = Pattern.compile("`([^`]+)`");
  private static final Pattern LINK = Pattern.compile("\\[([^\\]]+)\\]\\([^)]+\\)");
  private static final Pattern BULLET = Pattern.compile("(?m)^\\s*[*\\-+]\\s+");
  private static final Pattern RULE = Pattern.compile("(?m)^---+$");
  private static final Pattern BLANK_RUN = Pattern.compile("\\n\\s*\\n\\s*\\n");

  private MarkdownText() {}

  public static String toPlainText(String markdown) {
    if (markdown == null) {
      return "";
    }
    String text = HEADER.matcher(markdown).replaceAll("");
    text = BOLD_STARS.matcher(text).replaceAll("$1");
    text = ITALIC_STAR.matcher(text).replaceAll("$1");
    text = BOLD_UNDERSCORES.matcher(text).replaceAll("$1");
    text = ITALIC_UNDERSCORE.matcher(text).replaceAll("$1");
    text = CODE_BLOCK.matcher(text).replaceAll("");
    text = INLINE_CODE.matcher(text).replaceAll("$1");
    text = LINK.matcher(text).replaceAll("$1");
    text = BULLET.matcher(text).replaceAll("• ");
    text = RULE.matcher(text).replaceAll("");
    text = BLANK_RUN.matcher(text).replaceAll("\n\n");
    return text.strip();
  }
}
