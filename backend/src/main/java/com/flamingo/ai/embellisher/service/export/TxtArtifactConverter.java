package com.flamingo.ai.embellisher.service.export;

import com.flamingo.ai.embellisher.domain.entity.Note;
import com.flamingo.ai.embellisher.domain.enums.ExportFormat;
import java.nio.charset.StandardCharsets;
import org.springframework.stereotype.Component;

/** Plain-text export: the enhanced content as UTF-8. */
@Component
public class TxtArtifactConverter implements ArtifactConverter {

  @Override
  public boolean supports(ExportFormat format) {
    return format == ExportFormat.TXT;
  }

  @Override
  public byte[] convert(Note note) {
    return note.getEnhancedContent().getBytes(StandardCharsets.UTF_8);
  }
}
