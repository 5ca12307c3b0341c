package com.scholary.notes.transcription;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import java.util.List;

/** Wire format of the transcription service's response. */
@JsonIgnoreProperties(ignoreUnknown = true)
public record WhisperResponse(String text, List<TranscriptSegment> segments, String language) {

  TranscriptionResult toResult() {
    return new TranscriptionResult(text, language, segments);
  }
}
