package com.scholary.notes.alignment;

import java.util.List;

/**
 * A note section with the transcript ranges it was aligned to.
 *
 * <p>{@code startTime} and {@code endTime} are null and {@code duration} is 0 when nothing
 * matched.
 */
public record SectionMapping(
    String title,
    String content,
    int level,
    SectionKind kind,
    List<MatchedRange> timestamps,
    Double startTime,
    Double endTime,
    double duration) {

  public SectionMapping {
    timestamps = List.copyOf(timestamps);
  }

  static SectionMapping of(NoteSection section, List<MatchedRange> ranges) {
    if (ranges.isEmpty()) {
      return new SectionMapping(
          section.title(),
          section.content(),
          section.level(),
          section.kind(),
          ranges,
          null,
          null,
          0);
    }
    double start = ranges.get(0).start();
    double end = ranges.get(ranges.size() - 1).end();
    return new SectionMapping(
        section.title(),
        section.content(),
        section.level(),
        section.kind(),
        ranges,
        start,
        end,
        end - start);
  }

  public boolean isMapped() {
    return !timestamps.isEmpty();
  }
}
