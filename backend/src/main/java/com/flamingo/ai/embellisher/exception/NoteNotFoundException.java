package com.flamingo.ai.embellisher.exception;

import java.util.UUID;

/** Exception thrown when a note does not exist or belongs to another user. */
public class NoteNotFoundException extends RuntimeException {

  private final UUID noteId;

  public NoteNotFoundException(UUID noteId) {
    super("Note not found: " + noteId);
    this.noteId = noteId;
  }

  public UUID getNoteId() {
    return noteId;
  }
}
