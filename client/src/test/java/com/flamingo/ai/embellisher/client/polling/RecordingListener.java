package com.flamingo.ai.embellisher.client.polling;

import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;

/** Collects listener calls for assertions; calls arrive on the scheduler thread. */
class RecordingListener<T> implements PollListener<T> {

  final List<T> updates = new CopyOnWriteArrayList<>();
  final List<T> completions = new CopyOnWriteArrayList<>();
  final List<Throwable> failures = new CopyOnWriteArrayList<>();
  final CountDownLatch firstUpdate = new CountDownLatch(1);
  final List<String> threads = new CopyOnWriteArrayList<>();

  @Override
  public void onUpdate(T value) {
    threads.add(Thread.currentThread().getName());
    updates.add(value);
    firstUpdate.countDown();
  }

  @Override
  public void onComplete(T value) {
    completions.add(value);
  }

  @Override
  public void onFailure(Throwable error) {
    failures.add(error);
  }
}
