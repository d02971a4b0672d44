package com.flamingo.ai.embellisher.client.model;

/** Server-side processing status of a note. */
public enum NoteStatus {
  PENDING,
  PROCESSING,
  COMPLETED,
  ERROR;

  public boolean isTerminal() {
    return this == COMPLETED || this == ERROR;
  }
}
