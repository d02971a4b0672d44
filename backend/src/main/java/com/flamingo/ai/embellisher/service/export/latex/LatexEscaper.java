package com.flamingo.ai.embellisher.service.export.latex;

/** Escapes text for use outside LaTeX math mode. */
final class LatexEscaper {

  private LatexEscaper() {}

  static String escape(String text) {
    if (text == null) {
      return "";
    }
    StringBuilder sb = new StringBuilder(text.length() + 16);
    for (int i = 0; i < text.length(); i++) {
      char c = text.charAt(i);
      switch (c) {
        case '\\' -> sb.append("\\textbackslash{}");
        case '&', '%', '$', '#', '_', '{', '}' -> sb.append('\\').append(c);
        case '~' -> sb.append("\\textasciitilde{}");
        case '^' -> sb.append("\\textasciicircum{}");
        default -> sb.append(c);
      }
    }
    return sb.toString();
  }

  /**
   * Escapes text but keeps {@code $...$} spans verbatim so inline math written by the enhancement
   * model still typesets. An unmatched {@code $} is escaped.
   */
  static String escapeKeepingMath(String text) {
    StringBuilder sb = new StringBuilder();
    int pos = 0;
    while (pos < text.length()) {
      int open = text.indexOf('$', pos);
      if (open < 0) {
        break;
      }
      int close = text.indexOf('$', open + 1);
      if (close < 0 || close == open + 1) {
        break;
      }
      sb.append(escape(text.substring(pos, open))).append(text, open, close + 1);
      pos = close + 1;
    }
    return sb.append(escape(text.substring(pos))).toString();
  }
}
