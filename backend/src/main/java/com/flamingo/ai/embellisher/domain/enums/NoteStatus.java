package com.flamingo.ai.embellisher.domain.enums;

/** Processing status of a note. */
public enum NoteStatus {
  /** Note created, waiting for a processing worker. */
  PENDING,

  /** Extraction and enhancement are running. */
  PROCESSING,

  /** Enhanced content is available. */
  COMPLETED,

  /** Processing failed; see the processing error. */
  ERROR;

  public boolean isTerminal() {
    return this == COMPLETED || this == ERROR;
  }

  /**
   * Checks whether a note in this status may move to {@code next}.
   *
   * <p>Allowed: PENDING to PROCESSING, PROCESSING to COMPLETED or ERROR, and PENDING to ERROR for
   * notes that fail before a worker picks them up.
   */
  public boolean canTransitionTo(NoteStatus next) {
    return switch (this) {
      case PENDING -> next == PROCESSING || next == ERROR;
      case PROCESSING -> next == COMPLETED || next == ERROR;
      case COMPLETED, ERROR -> false;
    };
  }
}
