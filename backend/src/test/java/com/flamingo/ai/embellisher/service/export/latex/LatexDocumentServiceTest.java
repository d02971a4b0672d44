package com.flamingo.ai.embellisher.service.export.latex;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.flamingo.ai.embellisher.agent.LatexConversionAgent;
import com.flamingo.ai.embellisher.config.EmbellisherProperties;
import com.flamingo.ai.embellisher.domain.entity.Note;
import com.flamingo.ai.embellisher.domain.enums.LatexStyle;
import com.flamingo.ai.embellisher.domain.model.ProcessingSettings;
import com.flamingo.ai.embellisher.domain.model.ProcessingSettings.PresentationMetadata;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.mockito.junit.jupiter.MockitoSettings;
import org.mockito.quality.Strictness;

@ExtendWith(MockitoExtension.class)
@MockitoSettings(strictness = Strictness.LENIENT)
@DisplayName("LatexDocumentService")
class LatexDocumentServiceTest {

  @Mock private LatexConversionAgent conversionAgent;

  private EmbellisherProperties properties;
  private SimpleMeterRegistry meterRegistry;
  private LatexDocumentService service;

  @BeforeEach
  void setUp() {
    properties = new EmbellisherProperties();
    meterRegistry = new SimpleMeterRegistry();
    service =
        new LatexDocumentService(
            conversionAgent, new MarkdownLatexRenderer(), properties, meterRegistry);
  }

  private static Note note(String content) {
    return Note.builder()
        .enhancedContent(content)
        .settings(
            ProcessingSettings.builder()
                .headers(true)
                .style(LatexStyle.PERSONAL)
                .presentation(PresentationMetadata.builder().title("Mitosis").build())
                .build())
        .build();
  }

  private double fallbackCount() {
    return meterRegistry.counter("export.latex.fallback").count();
  }

  @Nested
  @DisplayName("AI conversion")
  class AiConversion {

    @Test
    void shouldPassTitleAuthorStyleAndDefaultFont() {
      // Given
      when(conversionAgent.convert(anyString(), anyString(), anyString(), anyString(), anyString()))
          .thenReturn("\\documentclass{article}\n\\begin{document}\nHi\n\\end{document}");

      // When
      service.buildDocument(note("# Mitosis\n\nText"));

      // Then
      verify(conversionAgent)
          .convert("Mitosis", "Student", "personal", "Times New Roman", "# Mitosis\n\nText");
    }

    @Test
    void shouldStripCodeFenceAndCloseTruncatedDocument() {
      // Given
      when(conversionAgent.convert(anyString(), anyString(), anyString(), anyString(), anyString()))
          .thenReturn("```latex\n\\documentclass{article}\n\\begin{document}\nPartial\n```");

      // When
      String latex = service.buildDocument(note("text"));

      // Then
      assertThat(latex).startsWith("\\documentclass{article}");
      assertThat(latex).doesNotContain("```");
      assertThat(latex.stripTrailing()).endsWith("\\end{document}");
      assertThat(fallbackCount()).isZero();
    }

    @Test
    void shouldWrapBodyInPreamble_whenModelReturnsOnlyBody() {
      // Given
      when(conversionAgent.convert(anyString(), anyString(), anyString(), anyString(), anyString()))
          .thenReturn("\\section{Mitosis}\nBody\n\\end{document}");

      // When
      String latex = service.buildDocument(note("text"));

      // Then
      assertThat(latex).startsWith("\\documentclass[12pt,a4paper]{article}");
      assertThat(latex).contains("\\maketitle\n\n\\section{Mitosis}\nBody");
      assertThat(latex.indexOf("\\end{document}"))
          .isEqualTo(latex.lastIndexOf("\\end{document}"));
    }

    @Test
    void shouldFallBackToRenderer_whenModelFails() {
      // Given
      when(conversionAgent.convert(anyString(), anyString(), anyString(), anyString(), anyString()))
          .thenThrow(new RuntimeException("model unavailable"));

      // When
      String latex = service.buildDocument(note("# Phases\n\n- Prophase"));

      // Then
      assertThat(latex).contains("\\section{Phases}").contains("\\item Prophase");
      assertThat(fallbackCount()).isEqualTo(1.0);
    }

    @Test
    void shouldFallBackToRenderer_whenModelReturnsBlank() {
      // Given
      when(conversionAgent.convert(anyString(), anyString(), anyString(), anyString(), anyString()))
          .thenReturn("  ");

      // When
      String latex = service.buildDocument(note("Plain"));

      // Then
      assertThat(latex).contains("\\maketitle\n\nPlain");
      assertThat(fallbackCount()).isEqualTo(1.0);
    }
  }

  @Test
  void shouldSkipModel_whenAiConversionDisabled() {
    // Given
    properties.getExport().setAiLatexEnabled(false);

    // When
    String latex = service.buildDocument(note("# Heading"));

    // Then
    assertThat(latex).contains("\\section{Heading}");
    verify(conversionAgent, never())
        .convert(anyString(), anyString(), anyString(), anyString(), anyString());
    assertThat(fallbackCount()).isZero();
  }

  @Test
  void shouldRemovePageBreakTokensAndHashOnlyLines() {
    String cleaned =
        LatexDocumentService.stripPageBreakTokens("Intro\n%P%P%P\n##\n\n\n\n# Real heading");

    assertThat(cleaned).isEqualTo("Intro\n\n# Real heading");
  }

  @Test
  void shouldDeclareUsedTheoremEnvironments() {
    String latex =
        "\\documentclass{article}\n\\begin{document}\n"
            + "\\begin{lemma}x\\end{lemma}\n\\begin{definition}y\\end{definition}\n"
            + "\\end{document}";

    String repaired = LatexDocumentService.ensureTheoremEnvironments(latex);

    int theorem = repaired.indexOf("\\newtheorem{theorem}{Theorem}");
    int lemma = repaired.indexOf("\\newtheorem{lemma}[theorem]{Lemma}");
    int begin = repaired.indexOf("\\begin{document}");
    assertThat(theorem).isPositive().isLessThan(lemma);
    assertThat(lemma).isLessThan(begin);
    assertThat(repaired).contains("\\newtheorem{definition}{Definition}");
    assertThat(repaired).doesNotContain("\\newtheorem{corollary}");
  }

  @Test
  void shouldLeaveDocumentUnchanged_whenNoTheoremEnvironmentUsed() {
    String latex = "\\documentclass{article}\n\\begin{document}\nx\n\\end{document}";

    assertThat(LatexDocumentService.ensureTheoremEnvironments(latex)).isEqualTo(latex);
  }
}
