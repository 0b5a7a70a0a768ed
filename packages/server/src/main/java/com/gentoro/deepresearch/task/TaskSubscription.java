package com.gentoro.deepresearch.task;

import java.time.Duration;
import java.util.Optional;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.TimeUnit;

/**
 * Unbounded delivery queue of snapshots for one subscriber of one task. Closing it unregisters it
 * from the {@link TaskManager}; the manager also closes it when the task is cleaned up.
 */
public final class TaskSubscription implements AutoCloseable {
  private final String taskId;
  private final TaskManager owner;
  private volatile TaskProgress initialSnapshot;
  private final BlockingQueue<TaskProgress> queue = new LinkedBlockingQueue<>();
  private volatile boolean closed;

  TaskSubscription(String taskId, TaskManager owner) {
    this.taskId = taskId;
    this.owner = owner;
  }

  public String taskId() {
    return taskId;
  }

  /**
   * Snapshot of the task at the moment this subscription was registered. Every queued snapshot
   * is newer than this one.
   */
  public TaskProgress initialSnapshot() {
    return initialSnapshot;
  }

  /** Wait up to {@code timeout} for the next snapshot. Empty on timeout. */
  public Optional<TaskProgress> poll(Duration timeout) throws InterruptedException {
    return Optional.ofNullable(queue.poll(timeout.toMillis(), TimeUnit.MILLISECONDS));
  }

  /** Next snapshot without waiting, if one is queued. */
  public Optional<TaskProgress> poll() {
    return Optional.ofNullable(queue.poll());
  }

  public int pending() {
    return queue.size();
  }

  public boolean isClosed() {
    return closed;
  }

  @Override
  public void close() {
    if (!closed) {
      closed = true;
      owner.unsubscribe(this);
    }
  }

  void deliver(TaskProgress snapshot) {
    if (closed) {
      throw new IllegalStateException("Subscription for task " + taskId + " is closed");
    }
    queue.add(snapshot);
  }

  void registeredAt(TaskProgress snapshot) {
    this.initialSnapshot = snapshot;
  }

  void markClosed() {
    closed = true;
  }
}
