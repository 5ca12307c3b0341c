package com.scholary.notes.transcription;

import java.util.List;
import java.util.stream.Collectors;

/**
 * Full transcript of one input.
 *
 * <p>When the service omits the flat text it is rebuilt from the segments.
 */
public record TranscriptionResult(String text, String language, List<TranscriptSegment> segments) {

  public TranscriptionResult {
    segments = segments == null ? List.of() : List.copyOf(segments);
    if (text == null || text.isBlank()) {
      text =
          segments.stream()
              .map(s -> s.text().trim())
              .filter(s -> !s.isEmpty())
              .collect(Collectors.joining(" "));
    }
    language = language == null || language.isBlank() ? "unknown" : language;
  }

  public boolean hasSegments() {
    return !segments.isEmpty();
  }
}
