package com.flamingo.ai.embellisher.client.polling;

/**
 * Receives the results of a poll loop. All methods are called on the scheduler thread, one at a
 * time and in query order. Exactly one of {@link #onComplete} and {@link #onFailure} is called
 * unless the loop is cancelled first.
 */
public interface PollListener<T> {

  /** Called with every query result, including the final one. */
  default void onUpdate(T value) {}

  /** Called once the stop condition holds. */
  default void onComplete(T value) {}

  /** Called when a query fails or the loop times out ({@link PollTimeoutException}). */
  default void onFailure(Throwable error) {}
}
