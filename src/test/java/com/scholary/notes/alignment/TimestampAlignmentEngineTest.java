package com.scholary.notes.alignment;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

import com.scholary.notes.transcription.TranscriptSegment;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import org.junit.jupiter.api.Test;

class TimestampAlignmentEngineTest {

  private final TimestampAlignmentEngine engine =
      new TimestampAlignmentEngine(AlignmentProperties.defaults());

  private static final List<TranscriptSegment> LECTURE =
      List.of(
          new TranscriptSegment(0.0, 6.0, "Welcome everyone to the second lecture on data structures"),
          new TranscriptSegment(6.0, 14.0, "A hash table maps keys to values using a hash function"),
          new TranscriptSegment(14.0, 20.0, "Collisions are resolved with chaining or open addressing"),
          new TranscriptSegment(40.0, 48.0, "Binary search trees keep their keys in sorted order"),
          new TranscriptSegment(48.0, 55.0, "An in-order traversal visits the keys in ascending order"),
          new TranscriptSegment(90.0, 96.0, "See you all next week for graphs"));

  @Test
  void align_shouldMapSectionToMatchingSegment() {
    List<TranscriptSegment> segments =
        List.of(
            new TranscriptSegment(0, 5, "intro to sets"),
            new TranscriptSegment(5, 12, "sets are collections of elements"));

    TimestampMapping mapping = engine.align("## Sets\nSets are collections of elements.", segments);

    assertThat(mapping.totalSections()).isEqualTo(1);
    assertThat(mapping.mappedSections()).isEqualTo(1);
    SectionMapping section = mapping.sections().get(0);
    assertThat(section.title()).isEqualTo("Sets");
    assertThat(section.timestamps()).hasSize(1);
    assertThat(section.startTime()).isCloseTo(5.0, within(0.001));
    assertThat(section.endTime()).isCloseTo(12.0, within(0.001));
    assertThat(section.duration()).isCloseTo(7.0, within(0.001));
    assertThat(section.timestamps().get(0).segmentIndices()).containsExactly(1);
    assertThat(mapping.coveragePercentage()).isGreaterThan(0.0);
    assertThat(mapping.coveragePercentage()).isCloseTo(7.0 / 12.0 * 100.0, within(0.01));
  }

  @Test
  void align_shouldReturnNoTimestampsForEmptyTranscript() {
    String notes = "# Course\n## Sets\nSets are collections of elements.\n## Maps\nMaps pair keys.";

    TimestampMapping mapping = engine.align(notes, List.of());

    assertThat(mapping.coveragePercentage()).isZero();
    assertThat(mapping.totalSections()).isEqualTo(3);
    assertThat(mapping.mappedSections()).isZero();
    assertThat(mapping.sections())
        .allSatisfy(
            section -> {
              assertThat(section.timestamps()).isEmpty();
              assertThat(section.startTime()).isNull();
              assertThat(section.endTime()).isNull();
              assertThat(section.duration()).isZero();
            });
  }

  @Test
  void align_shouldNotGiveClaimedSegmentToLaterSection() {
    String notes =
        "## Search trees\n"
            + "Binary search trees keep their keys in sorted order.\n"
            + "## Ordering\n"
            + "Binary search trees keep all their keys in sorted order.\n";

    TimestampMapping mapping = engine.align(notes, LECTURE);

    SectionMapping first = mapping.sections().get(0);
    SectionMapping second = mapping.sections().get(1);
    assertThat(indicesOf(first)).contains(3);
    assertThat(indicesOf(second)).doesNotContain(3);
  }

  @Test
  void align_shouldNeverShareSegmentsBetweenSections() {
    String notes =
        "# Data Structures\n"
            + "## Hash tables\n"
            + "A hash table maps keys to values using a hash function.\n"
            + "Collisions are resolved with chaining or open addressing.\n"
            + "## Trees\n"
            + "Binary search trees keep their keys in sorted order.\n"
            + "An in-order traversal visits the keys in ascending order.\n"
            + "## Summary\n"
            + "Hash tables and search trees both store keys with their values.\n";

    TimestampMapping mapping = engine.align(notes, LECTURE);

    Set<Integer> seen = new HashSet<>();
    for (SectionMapping section : mapping.sections()) {
      for (int index : indicesOf(section)) {
        assertThat(seen.add(index)).as("segment %d claimed twice", index).isTrue();
      }
    }
    assertThat(mapping.mappedSections()).isGreaterThanOrEqualTo(2);
  }

  @Test
  void align_shouldProduceOrderedNonOverlappingRangesWithinTranscriptSpan() {
    String notes =
        "## Everything\n"
            + "A hash table maps keys to values using a hash function.\n"
            + "Binary search trees keep their keys in sorted order.\n"
            + "See you all next week for graphs, said the lecturer.\n";

    TimestampMapping mapping = engine.align(notes, LECTURE);

    SectionMapping section = mapping.sections().get(0);
    assertThat(section.timestamps()).hasSizeGreaterThan(1);
    for (MatchedRange range : section.timestamps()) {
      assertThat(range.start()).isGreaterThanOrEqualTo(0.0);
      assertThat(range.end()).isLessThanOrEqualTo(96.0);
      assertThat(range.end()).isGreaterThanOrEqualTo(range.start());
    }
    for (int i = 1; i < section.timestamps().size(); i++) {
      MatchedRange previous = section.timestamps().get(i - 1);
      MatchedRange current = section.timestamps().get(i);
      assertThat(current.start()).isGreaterThanOrEqualTo(previous.end());
    }
    assertThat(mapping.coveragePercentage()).isBetween(0.0, 100.0);
  }

  @Test
  void align_shouldMergeNearbySegmentsIntoOneRange() {
    String notes =
        "## Hashing\n"
            + "A hash table maps keys to values using a hash function.\n"
            + "Collisions are resolved with chaining or open addressing.\n";

    TimestampMapping mapping = engine.align(notes, LECTURE);

    MatchedRange range = mapping.sections().get(0).timestamps().get(0);
    assertThat(range.segmentIndices()).containsExactly(1, 2);
    assertThat(range.start()).isEqualTo(6.0);
    assertThat(range.end()).isEqualTo(20.0);
    assertThat(range.text()).contains("hash table").contains("Collisions");
  }

  @Test
  void align_shouldMatchTitleOnlySectionOnItsHeading() {
    List<TranscriptSegment> segments =
        List.of(
            new TranscriptSegment(0, 4, "good morning"),
            new TranscriptSegment(4, 9, "introduction to graph theory"));

    TimestampMapping mapping = engine.align("# Introduction to Graph Theory", segments);

    SectionMapping section = mapping.sections().get(0);
    assertThat(section.kind()).isEqualTo(SectionKind.TITLE_ONLY);
    assertThat(section.isMapped()).isTrue();
    assertThat(section.startTime()).isEqualTo(4.0);
  }

  @Test
  void align_shouldReturnEmptyMappingForNotesWithoutHeadings() {
    TimestampMapping mapping = engine.align("Just a paragraph of text.", LECTURE);

    assertThat(mapping.totalSections()).isZero();
    assertThat(mapping.sections()).isEmpty();
    assertThat(mapping.coveragePercentage()).isZero();
  }

  @Test
  void coverage_shouldCountOverlappingRangesOnce() {
    List<TranscriptSegment> transcript =
        List.of(new TranscriptSegment(0, 50, "a"), new TranscriptSegment(50, 100, "b"));
    MatchedRange first = new MatchedRange(0, 60, "a", 1.0, "a", List.of(0));
    MatchedRange second = new MatchedRange(40, 80, "b", 1.0, "b", List.of(1));
    List<SectionMapping> mappings =
        List.of(
            SectionMapping.of(new NoteSection("A", "", 2, SectionKind.TITLE_ONLY), List.of(first)),
            SectionMapping.of(new NoteSection("B", "", 2, SectionKind.TITLE_ONLY), List.of(second)));

    assertThat(TimestampAlignmentEngine.coverage(mappings, transcript))
        .isCloseTo(80.0, within(0.001));
  }

  @Test
  void coverage_shouldBeZeroForZeroLengthTranscript() {
    List<TranscriptSegment> transcript = List.of(new TranscriptSegment(3, 3, "blip"));

    assertThat(TimestampAlignmentEngine.coverage(List.of(), transcript)).isZero();
  }

  private static List<Integer> indicesOf(SectionMapping section) {
    return section.timestamps().stream()
        .flatMap(range -> range.segmentIndices().stream())
        .toList();
  }
}
