package com.scholary.notes.alignment;

import com.scholary.notes.alignment.SegmentMerger.ClaimedSegment;
import com.scholary.notes.transcription.TranscriptSegment;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Maps sections of generated notes back onto time-coded transcript segments.
 *
 * <p>Each section contributes phrases; each phrase is scored against every transcript segment
 * that no earlier phrase has claimed, and its best matches above the threshold are claimed.
 * Claims are global and greedy: sections are processed in document order, so a segment claimed
 * by an earlier section is never offered to a later one, even if the later one would fit better.
 * Notes usually follow the lecture's order, which makes this a reasonable tie-break.
 *
 * <p>The engine holds no mutable state and is safe to call from several workers at once.
 */
@Component
public class TimestampAlignmentEngine {

  private static final Logger LOGGER = LoggerFactory.getLogger(TimestampAlignmentEngine.class);

  private final AlignmentProperties properties;
  private final PhraseExtractor phraseExtractor;

  public TimestampAlignmentEngine(AlignmentProperties properties) {
    this.properties = properties;
    this.phraseExtractor = new PhraseExtractor(properties);
  }

  /**
   * Align a notes document with a transcript.
   *
   * @param notes markdown notes with ATX headings
   * @param segments transcript segments, sorted by start
   * @return per-section ranges and overall coverage
   */
  public TimestampMapping align(String notes, List<TranscriptSegment> segments) {
    List<NoteSection> sections = NoteSectionParser.parse(notes);
    List<TranscriptSegment> transcript = segments == null ? List.of() : segments;

    String[] normalizedSegments = new String[transcript.size()];
    for (int i = 0; i < transcript.size(); i++) {
      normalizedSegments[i] = SequenceSimilarity.normalize(transcript.get(i).text());
    }

    boolean[] claimed = new boolean[transcript.size()];
    List<SectionMapping> mappings = new ArrayList<>(sections.size());

    for (NoteSection section : sections) {
      List<ClaimedSegment> evidence = new ArrayList<>();
      for (String phrase : phrasesFor(section)) {
        for (Candidate candidate : bestCandidates(phrase, normalizedSegments, claimed)) {
          claimed[candidate.index()] = true;
          TranscriptSegment segment = transcript.get(candidate.index());
          evidence.add(
              new ClaimedSegment(
                  candidate.index(),
                  segment.start(),
                  segment.end(),
                  segment.text(),
                  candidate.similarity(),
                  phrase));
        }
      }
      List<MatchedRange> ranges = SegmentMerger.merge(evidence, properties.mergeGapSeconds());
      mappings.add(SectionMapping.of(section, ranges));
    }

    int mapped = (int) mappings.stream().filter(SectionMapping::isMapped).count();
    double coverage = coverage(mappings, transcript);

    LOGGER.debug(
        "Aligned notes: sections={}, mapped={}, segments={}, coverage={}%",
        sections.size(),
        mapped,
        transcript.size(),
        String.format("%.1f", coverage));

    return new TimestampMapping(mappings, mappings.size(), mapped, coverage);
  }

  List<String> phrasesFor(NoteSection section) {
    if (section.kind() == SectionKind.CONTENT
        && section.content().length() >= properties.minContentLength()) {
      return phraseExtractor.extract(section.content());
    }

    // title-only and under-length sections are matched on their heading
    List<String> phrases = phraseExtractor.extract(section.title());
    if (phrases.isEmpty() && section.title().strip().length() >= properties.minContentLength()) {
      return List.of(section.title().strip());
    }
    return phrases;
  }

  private List<Candidate> bestCandidates(
      String phrase, String[] normalizedSegments, boolean[] claimed) {
    String normalizedPhrase = SequenceSimilarity.normalize(phrase);
    List<Candidate> candidates = new ArrayList<>();
    for (int i = 0; i < normalizedSegments.length; i++) {
      if (claimed[i]) {
        continue;
      }
      double similarity = SequenceSimilarity.ratio(normalizedPhrase, normalizedSegments[i]);
      if (similarity >= properties.similarityThreshold()) {
        candidates.add(new Candidate(i, similarity));
      }
    }
    // stable sort keeps segment order among equal scores
    candidates.sort(Comparator.comparingDouble(Candidate::similarity).reversed());
    return candidates.size() > properties.maxMatchesPerPhrase()
        ? candidates.subList(0, properties.maxMatchesPerPhrase())
        : candidates;
  }

  /** Union of all ranges over the transcript span, as a percentage. */
  static double coverage(List<SectionMapping> mappings, List<TranscriptSegment> transcript) {
    if (transcript.isEmpty()) {
      return 0.0;
    }

    double spanStart = Double.POSITIVE_INFINITY;
    double spanEnd = Double.NEGATIVE_INFINITY;
    for (TranscriptSegment segment : transcript) {
      spanStart = Math.min(spanStart, segment.start());
      spanEnd = Math.max(spanEnd, segment.end());
    }
    double span = spanEnd - spanStart;
    if (span <= 0) {
      return 0.0;
    }

    List<MatchedRange> ranges = new ArrayList<>();
    for (SectionMapping mapping : mappings) {
      ranges.addAll(mapping.timestamps());
    }
    ranges.sort(Comparator.comparingDouble(MatchedRange::start));

    double covered = 0.0;
    double currentStart = Double.NaN;
    double currentEnd = Double.NaN;
    for (MatchedRange range : ranges) {
      if (Double.isNaN(currentStart) || range.start() > currentEnd) {
        if (!Double.isNaN(currentStart)) {
          covered += currentEnd - currentStart;
        }
        currentStart = range.start();
        currentEnd = range.end();
      } else {
        currentEnd = Math.max(currentEnd, range.end());
      }
    }
    if (!Double.isNaN(currentStart)) {
      covered += currentEnd - currentStart;
    }

    double percentage = covered / span * 100.0;
    return Math.max(0.0, Math.min(100.0, percentage));
  }

  private record Candidate(int index, double similarity) {}
}
