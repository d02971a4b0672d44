package com.flamingo.ai.embellisher.client.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import java.time.LocalDateTime;
import java.util.UUID;

/** Client projection of a note as returned by the server. */
@JsonIgnoreProperties(ignoreUnknown = true)
public record NoteView(
    UUID id,
    NoteStatus status,
    int progress,
    String progressMessage,
    String processingError,
    String enhancedContent,
    String pdfUrl,
    String docxUrl,
    String txtUrl,
    LocalDateTime createdAt) {

  public boolean isTerminal() {
    return status != null && status.isTerminal();
  }
}
