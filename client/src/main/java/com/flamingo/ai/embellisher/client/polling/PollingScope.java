package com.flamingo.ai.embellisher.client.polling;

import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import lombok.extern.slf4j.Slf4j;

/**
 * Owns the scheduler thread that poll loops run on and cancels them together.
 *
 * <p>Closing the scope cancels every loop started through it that is still running; a scope
 * created with {@link #create()} also shuts its scheduler down.
 */
@Slf4j
public final class PollingScope implements AutoCloseable {

  private final ScheduledExecutorService scheduler;
  private final boolean ownsScheduler;
  private final Set<PollHandle<?>> active = ConcurrentHashMap.newKeySet();
  private volatile boolean closed;

  private PollingScope(ScheduledExecutorService scheduler, boolean ownsScheduler) {
    this.scheduler = scheduler;
    this.ownsScheduler = ownsScheduler;
  }

  /** Creates a scope with its own single scheduler thread. */
  public static PollingScope create() {
    return new PollingScope(
        Executors.newSingleThreadScheduledExecutor(
            runnable -> {
              Thread thread = new Thread(runnable, "embellisher-poll");
              thread.setDaemon(true);
              return thread;
            }),
        true);
  }

  /** Creates a scope on a scheduler the caller keeps ownership of. */
  public static PollingScope on(ScheduledExecutorService scheduler) {
    return new PollingScope(scheduler, false);
  }

  /**
   * Starts a poll loop tied to this scope.
   *
   * @throws IllegalStateException if the scope is closed
   */
  public <T> PollHandle<T> start(PollUntil<T> poll, PollListener<T> listener) {
    if (closed) {
      throw new IllegalStateException("Polling scope is closed");
    }
    PollHandle<T> handle = poll.start(scheduler, listener);
    active.add(handle);
    handle.result().whenComplete((value, error) -> active.remove(handle));
    if (closed) {
      handle.cancel();
    }
    return handle;
  }

  public ScheduledExecutorService scheduler() {
    return scheduler;
  }

  public boolean isClosed() {
    return closed;
  }

  int activeCount() {
    return active.size();
  }

  @Override
  public void close() {
    if (closed) {
      return;
    }
    closed = true;
    log.debug("Closing polling scope with {} active loops", active.size());
    for (PollHandle<?> handle : Set.copyOf(active)) {
      handle.cancel();
    }
    active.clear();
    if (ownsScheduler) {
      scheduler.shutdownNow();
    }
  }
}
