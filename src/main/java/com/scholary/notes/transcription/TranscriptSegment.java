package com.scholary.notes.transcription;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

/**
 * A single time-coded segment of transcribed audio.
 *
 * @param start start time in seconds
 * @param end end time in seconds, not before {@code start}
 * @param text the spoken text
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record TranscriptSegment(double start, double end, String text) {

  public TranscriptSegment {
    if (end < start) {
      throw new IllegalArgumentException(
          "Segment end " + end + " is before start " + start);
    }
    text = text == null ? "" : text;
  }
}
