package com.scholary.notes.media;

import com.scholary.notes.pipeline.AcquisitionException;
import java.io.IOException;
import java.nio.file.Path;
import java.util.regex.Pattern;
import org.apache.pdfbox.io.MemoryUsageSetting;
import org.apache.pdfbox.pdmodel.PDDocument;
import org.apache.pdfbox.text.PDFTextStripper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Extracts plain text from PDF documents with PDFBox.
 *
 * <p>Whitespace runs are collapsed and bare page numbers dropped. Documents yielding less than
 * the configured minimum text are rejected, since there is nothing to take notes on.
 */
@Component
public class PdfTextExtractor {

  private static final Logger LOGGER = LoggerFactory.getLogger(PdfTextExtractor.class);

  private static final Pattern PAGE_NUMBER_LINE = Pattern.compile("(?m)^\\s*(Page\\s+)?\\d+\\s*$");
  private static final Pattern HYPHENATED_BREAK = Pattern.compile("(\\w+)-\\s*\\R\\s*(\\w+)");
  private static final Pattern WHITESPACE = Pattern.compile("\\s+");

  private final MediaProperties properties;

  public PdfTextExtractor(MediaProperties properties) {
    this.properties = properties;
  }

  /**
   * Extract and clean the document's text.
   *
   * @throws AcquisitionException if the file isn't a readable PDF or holds too little text
   */
  public String extractText(Path pdf) {
    String raw;
    try (PDDocument document =
        PDDocument.load(pdf.toFile(), MemoryUsageSetting.setupTempFileOnly())) {
      if (document.isEncrypted()) {
        throw new AcquisitionException("Encrypted PDF is not supported");
      }
      PDFTextStripper stripper = new PDFTextStripper();
      stripper.setSortByPosition(true);
      raw = stripper.getText(document);
      LOGGER.info(
          "Extracted PDF text: file={}, pages={}, chars={}",
          pdf.getFileName(),
          document.getNumberOfPages(),
          raw.length());
    } catch (IOException e) {
      throw new AcquisitionException("Failed to read PDF: " + e.getMessage(), e);
    }

    String text = clean(raw);
    if (text.length() < properties.minDocumentChars()) {
      throw new AcquisitionException(
          "PDF appears to be empty or contains insufficient text content");
    }
    return text;
  }

  static String clean(String raw) {
    if (raw == null) {
      return "";
    }
    String text = HYPHENATED_BREAK.matcher(raw).replaceAll("$1$2");
    text = PAGE_NUMBER_LINE.matcher(text).replaceAll("");
    return WHITESPACE.matcher(text).replaceAll(" ").strip();
  }
}
