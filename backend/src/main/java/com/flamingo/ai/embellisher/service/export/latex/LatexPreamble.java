package com.flamingo.ai.embellisher.service.export.latex;

import com.flamingo.ai.embellisher.domain.enums.LatexStyle;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;

/** Preamble pieces shared by the AI and fallback LaTeX paths. */
final class LatexPreamble {

  /** Theorem-like environments and the declaration each one needs. */
  static final Map<String, String> THEOREM_DECLARATIONS = new LinkedHashMap<>();

  static {
    THEOREM_DECLARATIONS.put("theorem", "\\newtheorem{theorem}{Theorem}");
    THEOREM_DECLARATIONS.put("lemma", "\\newtheorem{lemma}[theorem]{Lemma}");
    THEOREM_DECLARATIONS.put("definition", "\\newtheorem{definition}{Definition}");
    THEOREM_DECLARATIONS.put("corollary", "\\newtheorem{corollary}{Corollary}");
  }

  private LatexPreamble() {}

  /** Maps a friendly font name to package directives; Times-like serif by default. */
  static String fontPackages(String fontPreference) {
    String font = fontPreference == null ? "" : fontPreference.toLowerCase(Locale.ROOT);
    if (font.contains("helvetica") || font.contains("arial")) {
      return "\\usepackage[scaled]{helvet}\n\\renewcommand\\familydefault{\\sfdefault}\n";
    }
    if (font.contains("palatino")) {
      return "\\usepackage{mathpazo}\n";
    }
    if (font.contains("garamond")) {
      return "\\usepackage{garamondx}\n";
    }
    if (font.contains("mono")) {
      return "\\renewcommand{\\familydefault}{\\ttdefault}\n";
    }
    return "\\usepackage{mathptmx}\n";
  }

  static String styleBlock(LatexStyle style) {
    LatexStyle effective = style == null ? LatexStyle.ACADEMIC : style;
    return switch (effective) {
      case ACADEMIC -> "\\linespread{1.1}\n\\setlength{\\parindent}{15pt}\n";
      case PERSONAL -> "\\setlength{\\parindent}{10pt}\n\\setlength{\\parskip}{8pt}\n";
      case MINIMALIST -> "\\setlength{\\parindent}{0pt}\n\\setlength{\\parskip}{10pt}\n";
    };
  }

  /** Full document head up to and including {@code \maketitle}. */
  static String head(String title, String author, LatexStyle style, String fontPreference) {
    String safeTitle = LatexEscaper.escape(title);
    String safeAuthor = LatexEscaper.escape(author);
    StringBuilder sb = new StringBuilder();
    sb.append("\\documentclass[12pt,a4paper]{article}\n")
        .append("\\usepackage[utf8]{inputenc}\n")
        .append("\\usepackage[T1]{fontenc}\n")
        .append("\\usepackage{amsmath,amssymb,amsthm}\n")
        .append("\\usepackage{graphicx}\n")
        .append("\\usepackage{hyperref}\n")
        .append("\\usepackage{fancyhdr}\n")
        .append("\\usepackage[margin=1in]{geometry}\n")
        .append(fontPackages(fontPreference))
        .append(styleBlock(style))
        .append('\n')
        .append("\\pagestyle{fancy}\n")
        .append("\\fancyhf{}\n")
        .append("\\rhead{").append(safeTitle).append("}\n")
        .append("\\cfoot{\\thepage}\n\n");
    THEOREM_DECLARATIONS.values().forEach(declaration -> sb.append(declaration).append('\n'));
    sb.append('\n')
        .append("\\title{").append(safeTitle).append("}\n")
        .append("\\author{").append(safeAuthor).append("}\n")
        .append("\\date{\\today}\n\n")
        .append("\\begin{document}\n")
        .append("\\maketitle\n\n");
    return sb.toString();
  }
}
