package com.scholary.notes.alignment;

import java.util.List;

/**
 * A contiguous stretch of transcript evidence for one section.
 *
 * @param start start of the first folded segment, seconds
 * @param end latest end among the folded segments, seconds
 * @param text segment texts joined with spaces
 * @param similarity best similarity among the folded segments
 * @param matchedPhrase phrase that claimed the earliest folded segment
 * @param segmentIndices transcript indices folded into this range, in start order
 */
public record MatchedRange(
    double start,
    double end,
    String text,
    double similarity,
    String matchedPhrase,
    List<Integer> segmentIndices) {

  public MatchedRange {
    segmentIndices = List.copyOf(segmentIndices);
  }

  public double duration() {
    return end - start;
  }
}
