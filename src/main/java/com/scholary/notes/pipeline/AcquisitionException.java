package com.scholary.notes.pipeline;

/** Input could not be downloaded, decoded or extracted. */
public class AcquisitionException extends PipelineException {

  public AcquisitionException(String message) {
    super(message);
  }

  public AcquisitionException(String message, Throwable cause) {
    super(message, cause);
  }

  @Override
  public boolean isFatal() {
    return true;
  }
}
