package com.scholary.notes.job;

/** What a job was submitted for. Drives credit pricing. */
public enum ActionType {
  /** Media file uploaded by the caller. */
  MEDIA_UPLOAD,
  /** Media pulled from the object store. */
  MEDIA_IMPORT,
  /** PDF or other text document. */
  DOCUMENT_UPLOAD
}
