package com.scholary.notes.alignment;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.stream.Collectors;

/** Folds claimed segments that sit close together in time into ranges. */
final class SegmentMerger {

  /** A segment claimed by one phrase. */
  record ClaimedSegment(
      int index, double start, double end, String text, double similarity, String phrase) {}

  private SegmentMerger() {}

  /**
   * Merge claimed segments.
   *
   * <p>Segments are sorted by start; each one whose start is within {@code maxGap} seconds of the
   * current group's end joins the group.
   */
  static List<MatchedRange> merge(List<ClaimedSegment> claimed, double maxGap) {
    List<MatchedRange> ranges = new ArrayList<>();
    if (claimed.isEmpty()) {
      return ranges;
    }

    List<ClaimedSegment> sorted = new ArrayList<>(claimed);
    sorted.sort(Comparator.comparingDouble(ClaimedSegment::start));

    List<ClaimedSegment> group = new ArrayList<>();
    double groupEnd = Double.NEGATIVE_INFINITY;
    for (ClaimedSegment segment : sorted) {
      if (!group.isEmpty() && segment.start() - groupEnd > maxGap) {
        ranges.add(fold(group));
        group = new ArrayList<>();
      }
      group.add(segment);
      groupEnd = group.size() == 1 ? segment.end() : Math.max(groupEnd, segment.end());
    }
    ranges.add(fold(group));
    return ranges;
  }

  private static MatchedRange fold(List<ClaimedSegment> group) {
    ClaimedSegment first = group.get(0);
    double end = Double.NEGATIVE_INFINITY;
    double similarity = 0;
    for (ClaimedSegment segment : group) {
      end = Math.max(end, segment.end());
      similarity = Math.max(similarity, segment.similarity());
    }
    String text = group.stream().map(ClaimedSegment::text).collect(Collectors.joining(" "));
    List<Integer> indices = group.stream().map(ClaimedSegment::index).toList();
    return new MatchedRange(first.start(), end, text, similarity, first.phrase(), indices);
  }
}
