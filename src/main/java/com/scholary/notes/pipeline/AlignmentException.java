package com.scholary.notes.pipeline;

/** Alignment failed; the job completes without timestamped notes. */
public class AlignmentException extends PipelineException {

  public AlignmentException(String message) {
    super(message);
  }

  public AlignmentException(String message, Throwable cause) {
    super(message, cause);
  }

  @Override
  public boolean isFatal() {
    return false;
  }
}
