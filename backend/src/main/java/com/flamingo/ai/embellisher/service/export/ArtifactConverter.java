package com.flamingo.ai.embellisher.service.export;

import com.flamingo.ai.embellisher.domain.entity.Note;
import com.flamingo.ai.embellisher.domain.enums.ExportFormat;

/** Converts the enhanced content of a completed note into one export format. */
public interface ArtifactConverter {

  boolean supports(ExportFormat format);

  /**
   * Produces the artifact bytes.
   *
   * @param note a completed note with enhanced content
   */
  byte[] convert(Note note);
}
