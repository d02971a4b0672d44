package com.flamingo.ai.embellisher.exception;

import java.util.UUID;

/** Exception thrown when a pipeline step cannot produce usable content. */
public class NoteProcessingException extends RuntimeException {

  private final UUID noteId;

  public NoteProcessingException(UUID noteId, String message) {
    super(message);
    this.noteId = noteId;
  }

  public NoteProcessingException(UUID noteId, String message, Throwable cause) {
    super(message, cause);
    this.noteId = noteId;
  }

  public UUID getNoteId() {
    return noteId;
  }
}
