package com.flamingo.ai.embellisher.agent;

import dev.langchain4j.service.SystemMessage;
import dev.langchain4j.service.UserMessage;
import dev.langchain4j.service.V;

/** AI agent that typesets Markdown notes as a complete LaTeX document. */
public interface LatexConversionAgent {

  @SystemMessage(
      """
        You convert Markdown study notes into a complete, compilable LaTeX document for pdflatex.

        Rules:
        - Output raw LaTeX only, starting with \\documentclass and ending with \\end{document}.
          Do not wrap the output in code fences.
        - Only use packages available in a standard TeX Live installation.
        - Map headings to \\section, \\subsection and \\subsubsection, lists to itemize or
          enumerate, emphasis to \\textbf and \\textit.
        - Escape special characters (& % $ # _ { } ~ ^ \\) outside math mode.
        - Declare every theorem-like environment you use with \\newtheorem.
        """)
  @UserMessage(
      """
        Title: {{title}}
        Author: {{author}}
        Style: {{style}}
        Font: {{font}}

        Markdown:
        {{content}}
        """)
  String convert(
      @V("title") String title,
      @V("author") String author,
      @V("style") String style,
      @V("font") String font,
      @V("content") String content);
}
