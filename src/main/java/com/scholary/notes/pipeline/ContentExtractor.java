package com.scholary.notes.pipeline;

import com.scholary.notes.config.PipelineProperties;
import com.scholary.notes.media.MediaToolkit;
import com.scholary.notes.media.PdfTextExtractor;
import java.nio.file.Path;
import java.nio.file.Paths;
import org.springframework.stereotype.Component;

/** Turns the acquired input into what later stages consume: a WAV file or document text. */
@Component
public class ContentExtractor {

  private final MediaToolkit mediaToolkit;
  private final PdfTextExtractor pdfTextExtractor;
  private final Path tempDir;

  public ContentExtractor(
      MediaToolkit mediaToolkit, PdfTextExtractor pdfTextExtractor, PipelineProperties properties) {
    this.mediaToolkit = mediaToolkit;
    this.pdfTextExtractor = pdfTextExtractor;
    this.tempDir = Paths.get(properties.tempDir());
  }

  /** @throws AcquisitionException if extraction fails */
  public void extract(JobContext context) {
    if (context.kind().isMedia()) {
      Path audio = tempDir.resolve(context.jobId() + "_audio.wav");
      context.addTempFile(audio);
      context.setAudioFile(mediaToolkit.extractAudio(context.sourceFile(), audio));
    } else {
      context.setDocumentText(pdfTextExtractor.extractText(context.sourceFile()));
    }
  }
}
