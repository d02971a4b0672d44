package com.flamingo.ai.embellisher.exception;

/** Exception thrown when an artifact cannot be written to or read from storage. */
public class ArtifactStorageException extends RuntimeException {

  public ArtifactStorageException(String message, Throwable cause) {
    super(message, cause);
  }
}
