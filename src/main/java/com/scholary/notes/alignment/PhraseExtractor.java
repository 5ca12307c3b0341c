package com.scholary.notes.alignment;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Pulls matchable phrases out of a section's text.
 *
 * <p>Sentences of reasonable length that aren't discourse filler come first, in order, followed
 * by double-quoted spans. The list is capped so one long section can't dominate the scoring.
 */
public class PhraseExtractor {

  private static final Pattern BOLD = Pattern.compile("\\*\\*([^*]+)\\*\\*");
  private static final Pattern ITALIC = Pattern.compile("\\*([^*]+)\\*");
  private static final Pattern CODE = Pattern.compile("`([^`]+)`");
  private static final Pattern BULLET = Pattern.compile("(?m)^\\s*[-*+]\\s+");
  private static final Pattern SENTENCE_END = Pattern.compile("[.!?]+");
  private static final Pattern QUOTED = Pattern.compile("\"([^\"]+)\"");

  private static final List<Pattern> FILLER =
      List.of(
          Pattern.compile("^(this|that|these|those|it|they)\\s+(is|are|was|were)"),
          Pattern.compile("^(in|on|at|for|with|by)\\s+this"),
          Pattern.compile("^(here|there)\\s+(is|are)"),
          Pattern.compile("^(as\\s+we\\s+can\\s+see|as\\s+mentioned|as\\s+discussed)"),
          Pattern.compile("^(the\\s+following|the\\s+above|the\\s+below)"));

  private final AlignmentProperties properties;

  public PhraseExtractor(AlignmentProperties properties) {
    this.properties = properties;
  }

  public List<String> extract(String text) {
    List<String> phrases = new ArrayList<>();
    if (text == null || text.isBlank()) {
      return phrases;
    }

    String clean = BOLD.matcher(text).replaceAll("$1");
    clean = ITALIC.matcher(clean).replaceAll("$1");
    clean = CODE.matcher(clean).replaceAll("$1");
    clean = BULLET.matcher(clean).replaceAll("");

    for (String sentence : SENTENCE_END.split(clean)) {
      String trimmed = sentence.strip();
      int length = trimmed.length();
      if (length > properties.minPhraseLength()
          && length < properties.maxPhraseLength()
          && !isFiller(trimmed)) {
        phrases.add(trimmed);
      }
    }

    // quotes come from the raw text so emphasis inside them survives
    Matcher quoted = QUOTED.matcher(text);
    while (quoted.find()) {
      String quote = quoted.group(1);
      if (quote.length() > properties.minQuoteLength()) {
        phrases.add(quote);
      }
    }

    return phrases.size() > properties.maxPhrasesPerSection()
        ? new ArrayList<>(phrases.subList(0, properties.maxPhrasesPerSection()))
        : phrases;
  }

  static boolean isFiller(String sentence) {
    String lower = sentence.toLowerCase();
    for (Pattern pattern : FILLER) {
      if (pattern.matcher(lower).lookingAt()) {
        return true;
      }
    }
    return false;
  }
}
