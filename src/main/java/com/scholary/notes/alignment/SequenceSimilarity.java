package com.scholary.notes.alignment;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.regex.Pattern;

/**
 * Ratcliff/Obershelp similarity between two strings.
 *
 * <p>The ratio is {@code 2*M/T}, where T is the combined length and M the number of characters in
 * matching blocks: the longest common substring, then recursively the longest common substrings
 * to its left and to its right. Both inputs are lowercased and stripped of everything that is
 * neither a word character nor whitespace before comparing.
 */
public final class SequenceSimilarity {

  private static final Pattern NON_WORD =
      Pattern.compile("[^\\w\\s]", Pattern.UNICODE_CHARACTER_CLASS);

  private SequenceSimilarity() {}

  /**
   * Similarity of two texts after normalization.
   *
   * @return a value in [0, 1]; 1.0 when both normalize to the empty string
   */
  public static double similarity(String text1, String text2) {
    return ratio(normalize(text1), normalize(text2));
  }

  static String normalize(String text) {
    if (text == null) {
      return "";
    }
    return NON_WORD.matcher(text.toLowerCase()).replaceAll("");
  }

  static double ratio(String a, String b) {
    int total = a.length() + b.length();
    if (total == 0) {
      return 1.0;
    }
    return 2.0 * matchingCharacters(a, b) / total;
  }

  /** Sum of the sizes of all matching blocks, found without recursion. */
  static int matchingCharacters(String a, String b) {
    int matched = 0;
    Deque<int[]> ranges = new ArrayDeque<>();
    ranges.push(new int[] {0, a.length(), 0, b.length()});

    while (!ranges.isEmpty()) {
      int[] range = ranges.pop();
      int aLo = range[0];
      int aHi = range[1];
      int bLo = range[2];
      int bHi = range[3];

      int[] match = longestMatch(a, aLo, aHi, b, bLo, bHi);
      int size = match[2];
      if (size == 0) {
        continue;
      }
      matched += size;

      int i = match[0];
      int j = match[1];
      if (aLo < i && bLo < j) {
        ranges.push(new int[] {aLo, i, bLo, j});
      }
      if (i + size < aHi && j + size < bHi) {
        ranges.push(new int[] {i + size, aHi, j + size, bHi});
      }
    }
    return matched;
  }

  /**
   * Longest common substring of {@code a[aLo:aHi]} and {@code b[bLo:bHi]}.
   *
   * <p>Of several equally long blocks the one starting earliest in {@code a} wins, then the one
   * starting earliest in {@code b}.
   *
   * @return {@code {i, j, size}}
   */
  static int[] longestMatch(String a, int aLo, int aHi, String b, int bLo, int bHi) {
    int bestI = aLo;
    int bestJ = bLo;
    int bestSize = 0;

    // lengths[j + 1] = length of the common suffix ending at a[i], b[j]
    int width = bHi - bLo;
    int[] previous = new int[width + 1];
    int[] current = new int[width + 1];

    for (int i = aLo; i < aHi; i++) {
      char ch = a.charAt(i);
      for (int j = bLo; j < bHi; j++) {
        int col = j - bLo + 1;
        if (ch == b.charAt(j)) {
          int length = previous[col - 1] + 1;
          current[col] = length;
          if (length > bestSize) {
            bestSize = length;
            bestI = i - length + 1;
            bestJ = j - length + 1;
          }
        } else {
          current[col] = 0;
        }
      }
      int[] swap = previous;
      previous = current;
      current = swap;
    }
    return new int[] {bestI, bestJ, bestSize};
  }
}
