package com.flamingo.ai.embellisher.client.polling;

import java.time.Duration;

/** Raised when a poll loop gives up before its condition was met. */
public class PollTimeoutException extends RuntimeException {

  private final int attempts;
  private final Duration elapsed;

  public PollTimeoutException(String message, int attempts, Duration elapsed) {
    super(message);
    this.attempts = attempts;
    this.elapsed = elapsed;
  }

  public int getAttempts() {
    return attempts;
  }

  public Duration getElapsed() {
    return elapsed;
  }
}
