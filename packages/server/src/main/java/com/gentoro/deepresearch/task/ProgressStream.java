package com.gentoro.deepresearch.task;

import java.io.IOException;
import java.time.Duration;
import java.util.Objects;
import java.util.Optional;

/**
 * Streams the progress of one task to a {@link ProgressSink}: the current snapshot first, then
 * every update as it happens, with a {@code ping} whenever nothing arrived within the keepalive
 * interval. The stream ends after a terminal snapshot, when the sink closes, or when the task is
 * cleaned up.
 */
public final class ProgressStream {
  private static final org.slf4j.Logger log =
      com.gentoro.deepresearch.logging.LoggingService.getLogger(ProgressStream.class);

  public static final Duration DEFAULT_KEEPALIVE = Duration.ofSeconds(30);

  private final TaskManager tasks;
  private final Duration keepaliveInterval;

  public ProgressStream(TaskManager tasks) {
    this(tasks, DEFAULT_KEEPALIVE);
  }

  public ProgressStream(TaskManager tasks, Duration keepaliveInterval) {
    this.tasks = Objects.requireNonNull(tasks, "tasks");
    if (keepaliveInterval == null || keepaliveInterval.isZero() || keepaliveInterval.isNegative()) {
      throw new IllegalArgumentException("keepaliveInterval must be positive");
    }
    this.keepaliveInterval = keepaliveInterval;
  }

  /**
   * Block the calling thread while streaming {@code taskId}.
   *
   * @return false if the task is unknown, true once the stream has ended
   */
  public boolean stream(String taskId, ProgressSink sink) throws IOException, InterruptedException {
    Optional<TaskSubscription> opened = tasks.subscribe(taskId);
    if (opened.isEmpty()) {
      return false;
    }

    try (TaskSubscription subscription = opened.get()) {
      TaskProgress current = subscription.initialSnapshot();
      sink.send(ProgressEvent.progress(current));
      if (current.status().isTerminal()) {
        return true;
      }

      while (sink.isOpen() && !subscription.isClosed()) {
        Optional<TaskProgress> next = subscription.poll(keepaliveInterval);
        if (next.isEmpty()) {
          sink.send(ProgressEvent.ping());
          continue;
        }
        sink.send(ProgressEvent.progress(next.get()));
        if (next.get().status().isTerminal()) {
          break;
        }
      }
      log.debug("Progress stream for task {} ended", taskId);
      return true;
    }
  }

  public Duration keepaliveInterval() {
    return keepaliveInterval;
  }
}
