package com.flamingo.ai.embellisher.service.export.latex;

import static org.assertj.core.api.Assertions.assertThat;

import org.junit.jupiter.api.Test;

class LatexEscaperTest {

  @Test
  void shouldEscapeSpecialCharacters() {
    assertThat(LatexEscaper.escape("50% of R&D_costs #1 {x} ~ ^ \\"))
        .isEqualTo(
            "50\\% of R\\&D\\_costs \\#1 \\{x\\} \\textasciitilde{} \\textasciicircum{}"
                + " \\textbackslash{}");
  }

  @Test
  void shouldReturnEmpty_whenTextIsNull() {
    assertThat(LatexEscaper.escape(null)).isEmpty();
  }

  @Test
  void shouldKeepInlineMath_whenDollarSpansAreBalanced() {
    assertThat(LatexEscaper.escapeKeepingMath("Energy $E = mc^2$ costs 5_units"))
        .isEqualTo("Energy $E = mc^2$ costs 5\\_units");
  }

  @Test
  void shouldEscapeDollar_whenUnmatched() {
    assertThat(LatexEscaper.escapeKeepingMath("Price is $5")).isEqualTo("Price is \\$5");
  }
}
