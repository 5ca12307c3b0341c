package com.scholary.notes.credit;

import com.scholary.notes.pipeline.PipelineException;

/** The credit ledger failed; the job still completes, uncharged. */
public class LedgerException extends PipelineException {

  public LedgerException(String message) {
    super(message);
  }

  public LedgerException(String message, Throwable cause) {
    super(message, cause);
  }

  @Override
  public boolean isFatal() {
    return false;
  }
}
