package com.scholary.notes.pipeline;

import com.scholary.notes.alignment.ExportFormat;
import com.scholary.notes.alignment.TimestampedNotesWriter;
import com.scholary.notes.artifact.ArtifactStore;
import com.scholary.notes.artifact.ArtifactType;
import com.scholary.notes.notes.MarkdownText;
import com.scholary.notes.transcription.TranscriptSegment;
import com.scholary.notes.transcription.TranscriptionResult;
import java.util.EnumMap;
import java.util.Locale;
import java.util.Map;
import java.util.function.Supplier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Persists a job's outputs.
 *
 * <p>Each artifact is written independently. A failed write is logged and the rest still go out;
 * the job's result flags only reflect the in-memory outputs.
 */
@Component
public class ArtifactWriter {

  private static final Logger LOGGER = LoggerFactory.getLogger(ArtifactWriter.class);
  private static final String RULE = "=".repeat(50);

  private static final Map<ExportFormat, ArtifactType> TIMESTAMPED_TYPES =
      new EnumMap<>(ExportFormat.class);

  static {
    TIMESTAMPED_TYPES.put(ExportFormat.JSON, ArtifactType.TIMESTAMPED_JSON);
    TIMESTAMPED_TYPES.put(ExportFormat.MARKDOWN, ArtifactType.TIMESTAMPED_MARKDOWN);
    TIMESTAMPED_TYPES.put(ExportFormat.SRT, ArtifactType.NOTES_SRT);
    TIMESTAMPED_TYPES.put(ExportFormat.VTT, ArtifactType.NOTES_VTT);
  }

  private final ArtifactStore artifactStore;
  private final TimestampedNotesWriter timestampedNotesWriter;

  public ArtifactWriter(ArtifactStore artifactStore, TimestampedNotesWriter timestampedNotesWriter) {
    this.artifactStore = artifactStore;
    this.timestampedNotesWriter = timestampedNotesWriter;
  }

  /**
   * Write every artifact the context has material for.
   *
   * @return number of artifacts that failed to write
   */
  public int writeAll(JobContext context) {
    String jobId = context.jobId();
    int failures = 0;

    if (context.transcription() != null) {
      failures +=
          write(jobId, ArtifactType.TRANSCRIPT, () -> formatTranscript(context.transcription()));
    }
    if (context.documentText() != null) {
      failures += write(jobId, ArtifactType.EXTRACTED_TEXT, context::documentText);
    }
    if (context.hasNotes()) {
      failures += write(jobId, ArtifactType.NOTES_MARKDOWN, context::notes);
      failures +=
          write(jobId, ArtifactType.NOTES_TEXT, () -> MarkdownText.toPlainText(context.notes()));
    }
    if (context.hasTimestampedNotes()) {
      for (Map.Entry<ExportFormat, ArtifactType> entry : TIMESTAMPED_TYPES.entrySet()) {
        failures +=
            write(
                jobId,
                entry.getValue(),
                () -> timestampedNotesWriter.write(context.mapping(), entry.getKey()));
      }
    }

    if (failures > 0) {
      LOGGER.warn("{} artifacts failed to save for job {}", failures, jobId);
    }
    return failures;
  }

  private int write(String jobId, ArtifactType type, Supplier<String> content) {
    try {
      artifactStore.write(jobId, type, content.get());
      return 0;
    } catch (RuntimeException e) {
      LOGGER.error("Failed to save artifact: jobId={}, type={}", jobId, type, e);
      return 1;
    }
  }

  static String formatTranscript(TranscriptionResult transcription) {
    StringBuilder out = new StringBuilder();
    out.append("Transcription Result\n");
    out.append("Language: ").append(transcription.language()).append('\n');
    out.append(RULE).append("\n\n");
    out.append(transcription.text()).append("\n\n");
    out.append(RULE).append('\n');
    out.append("Detailed Segments:\n\n");
    for (TranscriptSegment segment : transcription.segments()) {
      out.append(
              String.format(
                  Locale.ROOT,
                  "[%.2fs - %.2fs]: %s",
                  segment.start(),
                  segment.end(),
                  segment.text().strip()))
          .append('\n');
    }
    return out.toString();
  }
}
