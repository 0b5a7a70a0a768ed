package com.gentoro.deepresearch.task;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * In-memory registry of research tasks with fan-out of progress snapshots to subscribers.
 *
 * <p>Callers are trusted to drive the status sequence; no transition is validated. Every update
 * pushes one snapshot to each subscription registered at that moment. Delivery is best-effort: a
 * failing subscriber is logged and skipped, never failing the update or the other subscribers.
 */
public final class TaskManager {
  private static final org.slf4j.Logger log =
      com.gentoro.deepresearch.logging.LoggingService.getLogger(TaskManager.class);

  private final Clock clock;
  private final Map<String, TaskEntry> tasks = new ConcurrentHashMap<>();

  private static final class TaskEntry {
    private volatile TaskProgress current; // written under this
    private final List<TaskSubscription> subscribers = new CopyOnWriteArrayList<>();

    TaskEntry(TaskProgress initial) {
      this.current = initial;
    }
  }

  public TaskManager() {
    this(Clock.systemUTC());
  }

  public TaskManager(Clock clock) {
    this.clock = Objects.requireNonNull(clock, "clock");
  }

  /**
   * Register a new task in {@link TaskStatus#PLANNING} at 0%.
   *
   * @throws IllegalArgumentException if a task with this id is already registered
   */
  public TaskProgress createTask(String taskId) {
    Objects.requireNonNull(taskId, "taskId");
    TaskEntry entry = new TaskEntry(TaskProgress.initial(taskId, clock.instant()));
    if (tasks.putIfAbsent(taskId, entry) != null) {
      throw new IllegalArgumentException("Task already exists: " + taskId);
    }
    log.debug("Created task {}", taskId);
    return entry.current;
  }

  /**
   * Apply {@code update} and notify the current subscribers. Unknown ids are ignored.
   *
   * @return the new snapshot, or empty if the task is unknown
   */
  public Optional<TaskProgress> updateTask(String taskId, TaskUpdate update) {
    Objects.requireNonNull(update, "update");
    TaskEntry entry = tasks.get(taskId);
    if (entry == null) {
      log.debug("Ignoring update for unknown task {}", taskId);
      return Optional.empty();
    }

    TaskProgress snapshot;
    synchronized (entry) {
      snapshot = entry.current.apply(update);
      entry.current = snapshot;
      // Queues are unbounded: delivering under the lock never blocks and keeps update order.
      for (TaskSubscription subscription : entry.subscribers) {
        try {
          subscription.deliver(snapshot);
        } catch (RuntimeException e) {
          log.debug("Could not deliver update of task {} to a subscriber: {}", taskId, e.toString());
        }
      }
    }
    return Optional.of(snapshot);
  }

  /**
   * Open a new subscription receiving every update from now on. Nothing that happened before is
   * replayed; the snapshot current at registration is available as {@link
   * TaskSubscription#initialSnapshot()}.
   *
   * @return the subscription, or empty if the task is unknown
   */
  public Optional<TaskSubscription> subscribe(String taskId) {
    TaskEntry entry = tasks.get(taskId);
    if (entry == null) {
      return Optional.empty();
    }
    TaskSubscription subscription = new TaskSubscription(taskId, this);
    synchronized (entry) {
      subscription.registeredAt(entry.current);
      entry.subscribers.add(subscription);
    }
    return Optional.of(subscription);
  }

  public Optional<TaskProgress> getTask(String taskId) {
    TaskEntry entry = tasks.get(taskId);
    if (entry == null) return Optional.empty();
    synchronized (entry) {
      return Optional.of(entry.current);
    }
  }

  public int subscriberCount(String taskId) {
    TaskEntry entry = tasks.get(taskId);
    return entry == null ? 0 : entry.subscribers.size();
  }

  public int taskCount() {
    return tasks.size();
  }

  public int cleanupOldTasks(int maxAgeMinutes) {
    return cleanupOldTasks(Duration.ofMinutes(maxAgeMinutes));
  }

  /**
   * Remove tasks created strictly more than {@code maxAge} ago, closing their subscriptions.
   *
   * @return the number of removed tasks
   */
  public int cleanupOldTasks(Duration maxAge) {
    Instant cutoff = clock.instant().minus(maxAge);
    int removed = 0;
    for (Map.Entry<String, TaskEntry> e : tasks.entrySet()) {
      TaskEntry entry = e.getValue();
      if (entry.current.createdAt().isBefore(cutoff) && tasks.remove(e.getKey(), entry)) {
        entry.subscribers.forEach(TaskSubscription::markClosed);
        entry.subscribers.clear();
        removed++;
      }
    }
    if (removed > 0) {
      log.info("Removed {} tasks older than {} minutes", removed, maxAge.toMinutes());
    }
    return removed;
  }

  void unsubscribe(TaskSubscription subscription) {
    TaskEntry entry = tasks.get(subscription.taskId());
    if (entry != null) {
      entry.subscribers.remove(subscription);
    }
  }
}
