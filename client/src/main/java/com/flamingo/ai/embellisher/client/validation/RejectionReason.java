package com.flamingo.ai.embellisher.client.validation;

/** Why an input was refused before submission. All reasons are user-correctable. */
public enum RejectionReason {
  NO_FILES,
  TOO_MANY_FILES,
  FILE_TOO_LARGE,
  UNSUPPORTED_TYPE,
  TYPE_EXTENSION_MISMATCH,
  EMPTY_TEXT
}
