package com.flamingo.ai.embellisher.exception;

import com.flamingo.ai.embellisher.domain.enums.NoteStatus;
import java.util.UUID;

/** Exception thrown when an export is requested for a note without completed content. */
public class NoteNotReadyException extends RuntimeException {

  private final UUID noteId;
  private final NoteStatus status;

  public NoteNotReadyException(UUID noteId, NoteStatus status) {
    super("Note " + noteId + " is not ready for export (status " + status + ")");
    this.noteId = noteId;
    this.status = status;
  }

  public UUID getNoteId() {
    return noteId;
  }

  public NoteStatus getStatus() {
    return status;
  }

  public String getUserMessage() {
    return "Note processing is not complete yet. Wait until it finishes before exporting.";
  }
}
