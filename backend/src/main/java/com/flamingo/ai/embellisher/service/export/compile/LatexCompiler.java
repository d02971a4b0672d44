package com.flamingo.ai.embellisher.service.export.compile;

import com.flamingo.ai.embellisher.exception.CompilationException;

/** One way of turning LaTeX source into a PDF. */
public interface LatexCompiler {

  /** Short name used in logs and metrics. */
  String name();

  /** Whether this compiler is configured to be tried at all. */
  boolean isEnabled();

  /**
   * Compiles a complete LaTeX document.
   *
   * @return the PDF bytes
   * @throws CompilationException with kind COMPILER_UNAVAILABLE if the compiler cannot be reached
   *     or run, or MARKUP_REJECTED if it ran and refused the source
   */
  byte[] compile(String latex);
}
