package com.flamingo.ai.embellisher.exception;

/** Exception thrown when an AI model call fails. */
public class LlmServiceException extends RuntimeException {

  private final boolean rateLimited;
  private final String userMessage;

  public LlmServiceException(String message, Throwable cause) {
    super(message, cause);
    this.rateLimited = isRateLimit(cause);
    this.userMessage =
        rateLimited
            ? "Service is temporarily busy. Please try again in a moment."
            : "AI service is temporarily unavailable. Please try again later.";
  }

  public boolean isRateLimited() {
    return rateLimited;
  }

  public String getUserMessage() {
    return userMessage;
  }

  private static boolean isRateLimit(Throwable cause) {
    for (Throwable t = cause; t != null; t = t.getCause()) {
      String text = t.getClass().getSimpleName() + " " + t.getMessage();
      if (text.contains("RateLimit") || text.contains("429")) {
        return true;
      }
    }
    return false;
  }
}
