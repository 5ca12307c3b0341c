package com.scholary.notes.objectstore;

/**
 * Exception thrown when object storage operations fail.
 *
 * <p>Stage code wraps this into the pipeline's own exception types at the stage boundary.
 */
public class ObjectStoreException extends RuntimeException {

  public ObjectStoreException(String message) {
    super(message);
  }

  public ObjectStoreException(String message, Throwable cause) {
    super(message, cause);
  }
}
