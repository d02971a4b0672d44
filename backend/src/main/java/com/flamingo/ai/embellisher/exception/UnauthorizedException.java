package com.flamingo.ai.embellisher.exception;

/** Exception thrown when a request carries no valid bearer credential. */
public class UnauthorizedException extends RuntimeException {

  public UnauthorizedException(String message) {
    super(message);
  }

  public UnauthorizedException(String message, Throwable cause) {
    super(message, cause);
  }
}
