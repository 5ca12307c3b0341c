package com.scholary.notes.transcription;

import com.scholary.notes.pipeline.PipelineException;

/**
 * Thrown when the transcription service can't produce a transcript.
 *
 * <p>Network issues, service unavailability, or an unreadable response, after retries.
 */
public class TranscriptionException extends PipelineException {

  public TranscriptionException(String message) {
    super(message);
  }

  public TranscriptionException(String message, Throwable cause) {
    super(message, cause);
  }

  @Override
  public boolean isFatal() {
    return true;
  }
}
