package com.flamingo.ai.embellisher.exception;

/** Exception thrown when submitted note material violates upload constraints. */
public class InputValidationException extends RuntimeException {

  /** Why the input was rejected. */
  public enum Reason {
    NO_FILES,
    TOO_MANY_FILES,
    FILE_TOO_LARGE,
    UNSUPPORTED_TYPE,
    TYPE_MISMATCH,
    EMPTY_TEXT,
    TEXT_TOO_SHORT
  }

  private final Reason reason;

  public InputValidationException(Reason reason, String message) {
    super(message);
    this.reason = reason;
  }

  public Reason getReason() {
    return reason;
  }
}
