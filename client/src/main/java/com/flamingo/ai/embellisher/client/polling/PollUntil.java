package com.flamingo.ai.embellisher.client.polling;

import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.CompletionStage;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.Predicate;
import java.util.function.Supplier;
import lombok.extern.slf4j.Slf4j;

/**
 * Repeats an asynchronous query until its result satisfies a condition.
 *
 * <p>Queries never overlap: the next one is scheduled only after the previous result has been
 * delivered to the listener. The loop ends when the condition holds, when a query fails, when the
 * attempt limit or deadline is reached, or when it is cancelled. Instances are immutable and can
 * be started any number of times.
 */
@Slf4j
public final class PollUntil<T> {

  private final String name;
  private final Supplier<? extends CompletionStage<T>> query;
  private final Predicate<? super T> condition;
  private final Duration interval;
  private final Duration initialDelay;
  private final Duration timeout;
  private final int maxAttempts;

  private PollUntil(Builder<T> builder) {
    this.name = builder.name;
    this.query = Objects.requireNonNull(builder.query, "query");
    this.condition = Objects.requireNonNull(builder.condition, "condition");
    this.interval = Objects.requireNonNull(builder.interval, "interval");
    this.initialDelay = builder.initialDelay;
    this.timeout = builder.timeout;
    this.maxAttempts = builder.maxAttempts;
    if (timeout == null && maxAttempts <= 0) {
      throw new IllegalArgumentException("Either a timeout or a maximum attempt count is required");
    }
  }

  public static <T> Builder<T> builder(String name) {
    return new Builder<>(name);
  }

  public Duration getInterval() {
    return interval;
  }

  public Duration getTimeout() {
    return timeout;
  }

  public int getMaxAttempts() {
    return maxAttempts;
  }

  /** Starts the loop on {@code scheduler}; the first query runs after the initial delay. */
  public PollHandle<T> start(ScheduledExecutorService scheduler, PollListener<T> listener) {
    Run run = new Run(scheduler, listener);
    run.begin();
    return run;
  }

  private final class Run implements PollHandle<T> {

    private final ScheduledExecutorService scheduler;
    private final PollListener<T> listener;
    private final CompletableFuture<T> result = new CompletableFuture<>();
    private final AtomicBoolean finished = new AtomicBoolean();
    private final long startedAt = System.nanoTime();

    private volatile ScheduledFuture<?> pending;
    private volatile ScheduledFuture<?> watchdog;
    private int attempts;

    Run(ScheduledExecutorService scheduler, PollListener<T> listener) {
      this.scheduler = scheduler;
      this.listener = listener;
    }

    void begin() {
      if (timeout != null) {
        watchdog =
            scheduler.schedule(this::timedOut, timeout.toMillis(), TimeUnit.MILLISECONDS);
      }
      pending =
          scheduler.schedule(this::attempt, initialDelay.toMillis(), TimeUnit.MILLISECONDS);
    }

    private void attempt() {
      if (finished.get()) {
        return;
      }
      attempts++;
      log.debug("{}: attempt {}", name, attempts);
      CompletionStage<T> stage;
      try {
        stage = query.get();
      } catch (RuntimeException e) {
        fail(e);
        return;
      }
      stage.whenComplete(
          (value, error) -> {
            try {
              scheduler.execute(() -> deliver(value, error));
            } catch (RejectedExecutionException e) {
              log.debug("{}: scheduler shut down, dropping result of attempt {}", name, attempts);
            }
          });
    }

    private void deliver(T value, Throwable error) {
      if (finished.get()) {
        return;
      }
      if (error != null) {
        fail(unwrap(error));
        return;
      }
      try {
        listener.onUpdate(value);
      } catch (RuntimeException e) {
        fail(e);
        return;
      }
      if (condition.test(value)) {
        if (finish()) {
          notifyListener(() -> listener.onComplete(value));
          result.complete(value);
        }
        return;
      }
      if (maxAttempts > 0 && attempts >= maxAttempts) {
        giveUp("gave up after " + attempts + " attempts");
        return;
      }
      pending = scheduler.schedule(this::attempt, interval.toMillis(), TimeUnit.MILLISECONDS);
    }

    private void timedOut() {
      giveUp("timed out after " + timeout.toSeconds() + "s");
    }

    private void giveUp(String detail) {
      PollTimeoutException timeoutError =
          new PollTimeoutException(name + " " + detail, attempts, elapsed());
      if (finish()) {
        log.warn("{}", timeoutError.getMessage());
        notifyListener(() -> listener.onFailure(timeoutError));
        result.completeExceptionally(timeoutError);
      }
    }

    private void fail(Throwable error) {
      if (finish()) {
        log.debug("{}: failed on attempt {}: {}", name, attempts, error.toString());
        notifyListener(() -> listener.onFailure(error));
        result.completeExceptionally(error);
      }
    }

    private boolean finish() {
      if (!finished.compareAndSet(false, true)) {
        return false;
      }
      cancelScheduled(pending);
      cancelScheduled(watchdog);
      return true;
    }

    private void notifyListener(Runnable callback) {
      try {
        callback.run();
      } catch (RuntimeException e) {
        log.error("{}: listener failed", name, e);
      }
    }

    private Duration elapsed() {
      return Duration.ofNanos(System.nanoTime() - startedAt);
    }

    @Override
    public void cancel() {
      if (finish()) {
        log.debug("{}: cancelled after {} attempts", name, attempts);
        result.cancel(false);
      }
    }

    @Override
    public boolean isDone() {
      return finished.get();
    }

    @Override
    public CompletableFuture<T> result() {
      return result;
    }
  }

  private static void cancelScheduled(ScheduledFuture<?> future) {
    if (future != null) {
      future.cancel(false);
    }
  }

  static Throwable unwrap(Throwable error) {
    Throwable current = error;
    while ((current instanceof CompletionException || current instanceof ExecutionException)
        && current.getCause() != null) {
      current = current.getCause();
    }
    return current;
  }

  /** Builder for {@link PollUntil}. */
  public static final class Builder<T> {

    private final String name;
    private Supplier<? extends CompletionStage<T>> query;
    private Predicate<? super T> condition;
    private Duration interval;
    private Duration initialDelay = Duration.ZERO;
    private Duration timeout;
    private int maxAttempts;

    private Builder(String name) {
      this.name = name;
    }

    public Builder<T> query(Supplier<? extends CompletionStage<T>> query) {
      this.query = query;
      return this;
    }

    public Builder<T> until(Predicate<? super T> condition) {
      this.condition = condition;
      return this;
    }

    public Builder<T> interval(Duration interval) {
      this.interval = interval;
      return this;
    }

    public Builder<T> initialDelay(Duration initialDelay) {
      this.initialDelay = initialDelay;
      return this;
    }

    /** Overall deadline, measured from start. */
    public Builder<T> timeout(Duration timeout) {
      this.timeout = timeout;
      return this;
    }

    public Builder<T> maxAttempts(int maxAttempts) {
      this.maxAttempts = maxAttempts;
      return this;
    }

    public PollUntil<T> build() {
      return new PollUntil<>(this);
    }
  }
}
