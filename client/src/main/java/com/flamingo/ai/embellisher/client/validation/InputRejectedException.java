package com.flamingo.ai.embellisher.client.validation;

/** Thrown when a submission is attempted with input the validator refused. */
public class InputRejectedException extends RuntimeException {

  private final transient ValidationResult result;

  public InputRejectedException(ValidationResult result) {
    super(result.message());
    this.result = result;
  }

  public RejectionReason getReason() {
    return result.reason();
  }
}
