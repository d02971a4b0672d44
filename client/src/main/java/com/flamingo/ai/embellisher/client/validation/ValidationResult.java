package com.flamingo.ai.embellisher.client.validation;

/**
 * Outcome of an input check.
 *
 * @param reason null when accepted
 * @param message human-readable explanation, null when accepted
 */
public record ValidationResult(RejectionReason reason, String message) {

  private static final ValidationResult ACCEPTED = new ValidationResult(null, null);

  public static ValidationResult accepted() {
    return ACCEPTED;
  }

  public static ValidationResult rejected(RejectionReason reason, String message) {
    return new ValidationResult(reason, message);
  }

  public boolean isAccepted() {
    return reason == null;
  }
}
