package com.scholary.notes.alignment;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

import org.junit.jupiter.api.Test;

class SequenceSimilarityTest {

  @Test
  void ratio_shouldBeOneForIdenticalStrings() {
    assertThat(SequenceSimilarity.ratio("hello world", "hello world")).isEqualTo(1.0);
  }

  @Test
  void ratio_shouldCountMatchingCharactersOfBothStrings() {
    // "bcd" matches: 2 * 3 / 8
    assertThat(SequenceSimilarity.ratio("abcd", "bcde")).isCloseTo(0.75, within(1e-9));
  }

  @Test
  void ratio_shouldHandleEmptyStrings() {
    assertThat(SequenceSimilarity.ratio("", "")).isEqualTo(1.0);
    assertThat(SequenceSimilarity.ratio("", "abc")).isZero();
  }

  @Test
  void matchingCharacters_shouldRecurseOnBothSidesOfLongestBlock() {
    // blocks "ab" and "cd" around the unmatched "x"
    assertThat(SequenceSimilarity.matchingCharacters("abxcd", "abcd")).isEqualTo(4);
  }

  @Test
  void longestMatch_shouldPreferEarliestBlock() {
    int[] match = SequenceSimilarity.longestMatch("abab", 0, 4, "ab", 0, 2);

    assertThat(match).containsExactly(0, 0, 2);
  }

  @Test
  void normalize_shouldLowercaseAndStripPunctuation() {
    assertThat(SequenceSimilarity.normalize("Hello, World! It's 2024."))
        .isEqualTo("hello world its 2024");
    assertThat(SequenceSimilarity.normalize(null)).isEmpty();
  }

  @Test
  void similarity_shouldIgnoreCaseAndPunctuation() {
    assertThat(SequenceSimilarity.similarity("Sets are collections.", "sets are collections"))
        .isEqualTo(1.0);
  }

  @Test
  void similarity_shouldStayWithinUnitInterval() {
    double similarity =
        SequenceSimilarity.similarity(
            "binary search trees keep keys sorted", "see you all next week for graphs");

    assertThat(similarity).isBetween(0.0, 1.0);
  }
}
