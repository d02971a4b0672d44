package com.flamingo.ai.embellisher.client.polling;

import java.util.concurrent.CompletableFuture;

/** Control over a running poll loop. */
public interface PollHandle<T> {

  /** Stops the loop. No listener method is called afterwards. Idempotent. */
  void cancel();

  boolean isDone();

  /**
   * Completes with the value that met the condition, exceptionally with the failure, or is
   * cancelled when the loop is cancelled.
   */
  CompletableFuture<T> result();
}
