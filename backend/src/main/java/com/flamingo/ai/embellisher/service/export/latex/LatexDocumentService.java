package com.flamingo.ai.embellisher.service.export.latex;

import com.flamingo.ai.embellisher.agent.LatexConversionAgent;
import com.flamingo.ai.embellisher.config.EmbellisherProperties;
import com.flamingo.ai.embellisher.domain.entity.Note;
import com.flamingo.ai.embellisher.domain.model.ProcessingSettings;
import com.flamingo.ai.embellisher.service.export.ExportDocumentTitles;
import io.micrometer.core.annotation.Timed;
import io.micrometer.core.instrument.MeterRegistry;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * Produces the LaTeX source for a note's PDF export.
 *
 * <p>When enabled, the model typesets the content; its output is repaired (code fences removed,
 * missing document wrapper or {@code \end{document}} added, theorem environments declared). If
 * the model call fails, {@link MarkdownLatexRenderer} converts the Markdown directly.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class LatexDocumentService {

  private static final String END_DOCUMENT = "\\end{document}";

  private final LatexConversionAgent conversionAgent;
  private final MarkdownLatexRenderer fallbackRenderer;
  private final EmbellisherProperties properties;
  private final MeterRegistry meterRegistry;

  @Timed(value = "export.latex", description = "Time to build LaTeX source")
  public String buildDocument(Note note) {
    ProcessingSettings settings = note.getSettings();
    String title = ExportDocumentTitles.title(note);
    String author = ExportDocumentTitles.author(note);
    String content = stripPageBreakTokens(note.getEnhancedContent());

    if (properties.getExport().isAiLatexEnabled()) {
      try {
        String style = settings.getStyle() == null ? "academic" : settings.getStyle().name();
        String font =
            settings.getFontPreference() == null ? "Times New Roman" : settings.getFontPreference();
        String latex = conversionAgent.convert(title, author, style.toLowerCase(), font, content);
        if (latex != null && !latex.isBlank()) {
          return repair(latex, title, author, settings);
        }
        log.warn("AI LaTeX conversion returned no content for note {}", note.getId());
      } catch (RuntimeException e) {
        log.warn("AI LaTeX conversion failed for note {}: {}", note.getId(), e.getMessage());
      }
      meterRegistry.counter("export.latex.fallback").increment();
    }

    return fallbackRenderer.render(
        content, title, author, settings.getStyle(), settings.getFontPreference());
  }

  /** Removes page-break markers and lines holding only {@code #} characters. */
  static String stripPageBreakTokens(String content) {
    return content
        .replace("%P%P%P", "")
        .replaceAll("(?m)^#{1,3}\\s*$", "")
        .replaceAll("\n{3,}", "\n\n")
        .strip();
  }

  String repair(String latex, String title, String author, ProcessingSettings settings) {
    String result = stripCodeFence(latex.strip());
    if (!result.stripTrailing().endsWith(END_DOCUMENT)) {
      log.warn("LaTeX output was truncated, closing the document");
      result = result.stripTrailing() + "\n\n" + END_DOCUMENT + "\n";
    }
    if (!result.startsWith("\\documentclass")) {
      String body = result.substring(0, result.lastIndexOf(END_DOCUMENT)).strip();
      result =
          LatexPreamble.head(title, author, settings.getStyle(), settings.getFontPreference())
              + body
              + "\n\n"
              + END_DOCUMENT
              + "\n";
    }
    return ensureTheoremEnvironments(result);
  }

  /** Declares theorem-like environments that are used but not declared. */
  static String ensureTheoremEnvironments(String latex) {
    List<String> missing = new ArrayList<>();
    for (Map.Entry<String, String> entry : LatexPreamble.THEOREM_DECLARATIONS.entrySet()) {
      boolean used = latex.contains("\\begin{" + entry.getKey() + "}");
      boolean declared = latex.contains("\\newtheorem{" + entry.getKey() + "}");
      if (used && !declared) {
        missing.add(entry.getValue());
      }
    }
    if (missing.isEmpty()) {
      return latex;
    }
    // lemma shares the theorem counter
    String theorem = LatexPreamble.THEOREM_DECLARATIONS.get("theorem");
    if (missing.contains(LatexPreamble.THEOREM_DECLARATIONS.get("lemma"))
        && !missing.contains(theorem)
        && !latex.contains("\\newtheorem{theorem}")) {
      missing.add(0, theorem);
    }
    String block = "\n" + String.join("\n", missing) + "\n";
    int insertAt = latex.indexOf("\\begin{document}");
    return insertAt < 0
        ? block + latex
        : latex.substring(0, insertAt) + block + latex.substring(insertAt);
  }

  private static String stripCodeFence(String text) {
    if (!text.startsWith("```")) {
      return text;
    }
    List<String> lines = new ArrayList<>(List.of(text.split("\n", -1)));
    lines.remove(0);
    if (!lines.isEmpty() && lines.get(lines.size() - 1).strip().equals("```")) {
      lines.remove(lines.size() - 1);
    }
    return String.join("\n", lines).strip();
  }
}
