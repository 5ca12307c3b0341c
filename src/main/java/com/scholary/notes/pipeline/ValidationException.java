package com.scholary.notes.pipeline;

/** Input rejected before any expensive work: too large, or over the owner's plan limit. */
public class ValidationException extends PipelineException {

  public ValidationException(String message) {
    super(message);
  }

  @Override
  public boolean isFatal() {
    return true;
  }
}
