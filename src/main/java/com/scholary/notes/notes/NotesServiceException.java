package com.scholary.notes.notes;

/** A chat completion call failed. Never leaves the notes generator, which reports empty instead. */
class NotesServiceException extends RuntimeException {

  NotesServiceException(String message) {
    super(message);
  }

  NotesServiceException(String message, Throwable cause) {
    super(message, cause);
  }
}
