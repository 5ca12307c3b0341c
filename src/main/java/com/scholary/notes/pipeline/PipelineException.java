package com.scholary.notes.pipeline;

/**
 * Base exception for failures inside a job's stage chain.
 *
 * <p>A fatal exception ends the job in ERROR. A soft one is logged, and the job continues with the
 * stage's output missing.
 */
public abstract class PipelineException extends RuntimeException {

  protected PipelineException(String message) {
    super(message);
  }

  protected PipelineException(String message, Throwable cause) {
    super(message, cause);
  }

  public abstract boolean isFatal();
}
