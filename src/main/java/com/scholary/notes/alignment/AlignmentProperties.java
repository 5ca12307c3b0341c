package com.scholary.notes.alignment;

import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Positive;
import jakarta.validation.constraints.PositiveOrZero;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * Tuning knobs for timestamp alignment.
 *
 * @param similarityThreshold minimum similarity ratio for a segment to count as a match
 * @param minContentLength sections with shorter content are matched on their title
 * @param minPhraseLength sentences must be longer than this to become phrases
 * @param maxPhraseLength sentences must be shorter than this to become phrases
 * @param minQuoteLength quoted spans must be longer than this to become phrases
 * @param maxPhrasesPerSection cap on phrases per section
 * @param maxMatchesPerPhrase best segments kept per phrase
 * @param mergeGapSeconds claimed segments closer than this are folded into one range
 */
@ConfigurationProperties(prefix = "alignment")
@Validated
public record AlignmentProperties(
    @DecimalMin("0.0") @DecimalMax("1.0") double similarityThreshold,
    @PositiveOrZero int minContentLength,
    @PositiveOrZero int minPhraseLength,
    @Positive int maxPhraseLength,
    @PositiveOrZero int minQuoteLength,
    @Positive int maxPhrasesPerSection,
    @Positive int maxMatchesPerPhrase,
    @PositiveOrZero double mergeGapSeconds) {

  public static AlignmentProperties defaults() {
    return new AlignmentProperties(0.3, 10, 20, 200, 10, 10, 3, 5.0);
  }
}
