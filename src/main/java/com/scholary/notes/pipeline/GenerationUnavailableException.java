package com.scholary.notes.pipeline;

/** No notes could be generated; the job completes without them and is not charged. */
public class GenerationUnavailableException extends PipelineException {

  public GenerationUnavailableException(String message) {
    super(message);
  }

  public GenerationUnavailableException(String message, Throwable cause) {
    super(message, cause);
  }

  @Override
  public boolean isFatal() {
    return false;
  }
}
