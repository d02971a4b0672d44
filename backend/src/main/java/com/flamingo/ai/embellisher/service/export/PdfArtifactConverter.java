package com.flamingo.ai.embellisher.service.export;

import com.flamingo.ai.embellisher.domain.entity.Note;
import com.flamingo.ai.embellisher.domain.enums.ExportFormat;
import com.flamingo.ai.embellisher.service.export.compile.LatexCompilationChain;
import com.flamingo.ai.embellisher.service.export.latex.LatexDocumentService;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

/** Typeset PDF export: LaTeX source compiled through the compiler chain. */
@Component
@RequiredArgsConstructor
public class PdfArtifactConverter implements ArtifactConverter {

  private final LatexDocumentService latexDocumentService;
  private final LatexCompilationChain compilationChain;

  @Override
  public boolean supports(ExportFormat format) {
    return format == ExportFormat.PDF;
  }

  @Override
  public byte[] convert(Note note) {
    return compilationChain.compile(latexDocumentService.buildDocument(note));
  }
}
