package com.scholary.notes.alignment;

import java.util.List;

/**
 * Alignment result for a whole notes document.
 *
 * @param sections one mapping per section, in document order
 * @param totalSections number of sections parsed
 * @param mappedSections sections with at least one range
 * @param coveragePercentage share of the transcript span covered by any range, 0 to 100
 */
public record TimestampMapping(
    List<SectionMapping> sections,
    int totalSections,
    int mappedSections,
    double coveragePercentage) {

  public TimestampMapping {
    sections = List.copyOf(sections);
  }

  public static TimestampMapping empty() {
    return new TimestampMapping(List.of(), 0, 0, 0.0);
  }
}
