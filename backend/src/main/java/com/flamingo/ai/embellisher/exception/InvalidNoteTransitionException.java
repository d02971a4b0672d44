package com.flamingo.ai.embellisher.exception;

import com.flamingo.ai.embellisher.domain.enums.NoteStatus;
import java.util.UUID;

/** Exception thrown when a note status change is not allowed by the lifecycle. */
public class InvalidNoteTransitionException extends RuntimeException {

  private final UUID noteId;
  private final NoteStatus from;
  private final NoteStatus to;

  public InvalidNoteTransitionException(UUID noteId, NoteStatus from, NoteStatus to) {
    super("Note " + noteId + " cannot move from " + from + " to " + to);
    this.noteId = noteId;
    this.from = from;
    this.to = to;
  }

  public UUID getNoteId() {
    return noteId;
  }

  public NoteStatus getFrom() {
    return from;
  }

  public NoteStatus getTo() {
    return to;
  }
}
