package com.scholary.notes.pipeline;

import com.scholary.notes.job.ActionType;
import com.scholary.notes.notes.ContentType;

/** What kind of input a job processes. */
public enum InputKind {
  VIDEO,
  AUDIO,
  DOCUMENT;

  /** Media inputs are transcribed and aligned; documents are not. */
  public boolean isMedia() {
    return this != DOCUMENT;
  }

  /** Action billed when a job doesn't name one. */
  public ActionType defaultActionType() {
    return isMedia() ? ActionType.MEDIA_UPLOAD : ActionType.DOCUMENT_UPLOAD;
  }

  public ContentType contentType() {
    return isMedia() ? ContentType.VIDEO : ContentType.DOCUMENT;
  }
}
