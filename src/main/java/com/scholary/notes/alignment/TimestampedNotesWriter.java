package com.scholary.notes.alignment;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.io.UncheckedIOException;
import java.util.Locale;
import org.springframework.stereotype.Component;

/**
 * Writes timestamped notes in various formats.
 *
 * <p>JSON for programmatic consumers, an annotated markdown outline for people, and SRT/WebVTT
 * caption files for video players. Caption files hold one cue per mapped section, titled with the
 * section heading.
 */
@Component
public class TimestampedNotesWriter {

  private static final int EVIDENCE_PREVIEW_CHARS = 100;

  private final ObjectMapper objectMapper;

  public TimestampedNotesWriter(ObjectMapper objectMapper) {
    this.objectMapper = objectMapper;
  }

  public String write(TimestampMapping mapping, ExportFormat format) {
    return switch (format) {
      case JSON -> writeJson(mapping);
      case MARKDOWN -> writeMarkdown(mapping);
      case SRT -> writeSrt(mapping);
      case VTT -> writeVtt(mapping);
    };
  }

  /** Pretty-printed JSON of the whole mapping. */
  public String writeJson(TimestampMapping mapping) {
    try {
      return objectMapper.writerWithDefaultPrettyPrinter().writeValueAsString(mapping);
    } catch (JsonProcessingException e) {
      throw new UncheckedIOException("Failed to serialize timestamp mapping", e);
    }
  }

  /**
   * Annotated markdown outline.
   *
   * <p>Format:
   *
   * <pre>
   * # Timestamped Learning Notes
   *
   * **Coverage:** 42.0% of original audio
   *
   * ---
   *
   * ## Sets `[00:05 - 00:12]`
   *
   * Sets are collections of elements.
   *
   * **Audio Segments:**
   * - 00:05 - 00:12: sets are collections of elements
   *
   * ---
   * </pre>
   *
   * <p>Headings are demoted one level below the document title.
   */
  public String writeMarkdown(TimestampMapping mapping) {
    StringBuilder md = new StringBuilder();
    md.append("# Timestamped Learning Notes\n\n");
    md.append(
        String.format(
            Locale.ROOT, "**Coverage:** %.1f%% of original audio\n\n", mapping.coveragePercentage()));
    md.append("---\n\n");

    for (SectionMapping section : mapping.sections()) {
      md.append("#".repeat(Math.min(section.level() + 1, 6))).append(' ').append(section.title());
      if (section.startTime() != null) {
        md.append(" `[")
            .append(formatReadableTime(section.startTime()))
            .append(" - ")
            .append(formatReadableTime(section.endTime()))
            .append("]`");
      } else {
        md.append(" `[No timestamp found]`");
      }
      if (section.kind() == SectionKind.TITLE_ONLY) {
        md.append(" `[TITLE]`");
      }
      md.append("\n\n");

      if (!section.content().isBlank()) {
        md.append(section.content()).append("\n\n");
      } else if (section.kind() == SectionKind.TITLE_ONLY) {
        md.append("*This is a title-only section without additional content.*\n\n");
      }

      if (section.isMapped()) {
        md.append("**Audio Segments:**\n");
        for (MatchedRange range : section.timestamps()) {
          md.append("- ")
              .append(formatReadableTime(range.start()))
              .append(" - ")
              .append(formatReadableTime(range.end()))
              .append(": ")
              .append(preview(range.text()))
              .append('\n');
        }
        md.append('\n');
      }

      md.append("---\n\n");
    }
    return md.toString();
  }

  /**
   * SubRip captions.
   *
   * <pre>
   * 1
   * 00:00:05,000 --> 00:00:12,000
   * Sets
   * </pre>
   */
  public String writeSrt(TimestampMapping mapping) {
    StringBuilder srt = new StringBuilder();
    int counter = 1;
    for (SectionMapping section : mapping.sections()) {
      if (!section.isMapped()) {
        continue;
      }
      srt.append(counter++).append('\n');
      srt.append(formatTimecode(section.startTime(), ','))
          .append(" --> ")
          .append(formatTimecode(section.endTime(), ','))
          .append('\n');
      srt.append(section.title()).append("\n\n");
    }
    return srt.toString();
  }

  /** WebVTT captions; like SRT but with a header, no cue numbers and a dot before millis. */
  public String writeVtt(TimestampMapping mapping) {
    StringBuilder vtt = new StringBuilder("WEBVTT\n\n");
    for (SectionMapping section : mapping.sections()) {
      if (!section.isMapped()) {
        continue;
      }
      vtt.append(formatTimecode(section.startTime(), '.'))
          .append(" --> ")
          .append(formatTimecode(section.endTime(), '.'))
          .append('\n');
      vtt.append(section.title()).append("\n\n");
    }
    return vtt.toString();
  }

  /** HH:MM:SS,mmm (SRT) or HH:MM:SS.mmm (VTT). */
  static String formatTimecode(double seconds, char millisSeparator) {
    long totalMillis = Math.round(Math.max(0, seconds) * 1000);
    long hours = totalMillis / 3_600_000;
    long minutes = (totalMillis % 3_600_000) / 60_000;
    long secs = (totalMillis % 60_000) / 1000;
    long millis = totalMillis % 1000;
    return String.format(
        Locale.ROOT, "%02d:%02d:%02d%c%03d", hours, minutes, secs, millisSeparator, millis);
  }

  /** MM:SS; minutes keep counting past the hour. */
  static String formatReadableTime(double seconds) {
    long total = (long) Math.max(0, seconds);
    return String.format(Locale.ROOT, "%02d:%02d", total / 60, total % 60);
  }

  private static String preview(String text) {
    return text.length() > EVIDENCE_PREVIEW_CHARS
        ? text.substring(0, EVIDENCE_PREVIEW_CHARS) + "..."
        : text;
  }
}
