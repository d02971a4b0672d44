package com.flamingo.ai.embellisher.exception;

/** Exception thrown when typesetting markup cannot be compiled to PDF. */
public class CompilationException extends RuntimeException {

  /** Failure category. */
  public enum Kind {
    /** No compiler could be reached or run. */
    COMPILER_UNAVAILABLE,

    /** A compiler ran and rejected the markup. */
    MARKUP_REJECTED
  }

  private static final int MAX_LOG_CHARS = 4000;

  private final Kind kind;
  private final String compilerLog;

  public CompilationException(Kind kind, String message) {
    this(kind, message, null, null);
  }

  public CompilationException(Kind kind, String message, Throwable cause) {
    this(kind, message, null, cause);
  }

  public CompilationException(Kind kind, String message, String compilerLog, Throwable cause) {
    super(message, cause);
    this.kind = kind;
    this.compilerLog = excerpt(compilerLog);
  }

  public static CompilationException unavailable(String message, Throwable cause) {
    return new CompilationException(Kind.COMPILER_UNAVAILABLE, message, cause);
  }

  public static CompilationException rejected(String message, String compilerLog) {
    return new CompilationException(Kind.MARKUP_REJECTED, message, compilerLog, null);
  }

  public Kind getKind() {
    return kind;
  }

  public boolean isMarkupRejected() {
    return kind == Kind.MARKUP_REJECTED;
  }

  /** Tail of the compiler output, or null. */
  public String getCompilerLog() {
    return compilerLog;
  }

  public String getUserMessage() {
    return isMarkupRejected()
        ? "The document could not be typeset. Try a different style or simplify the content."
        : "PDF generation is temporarily unavailable. Please try again later.";
  }

  private static String excerpt(String log) {
    if (log == null || log.length() <= MAX_LOG_CHARS) {
      return log;
    }
    return log.substring(log.length() - MAX_LOG_CHARS);
  }
}
