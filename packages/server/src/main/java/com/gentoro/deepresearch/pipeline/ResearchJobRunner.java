package com.gentoro.deepresearch.pipeline;

import com.gentoro.deepresearch.cache.CacheKeys;
import com.gentoro.deepresearch.cache.TtlCache;
import com.gentoro.deepresearch.exception.ExceptionUtil;
import com.gentoro.deepresearch.exception.RateLimitExceededException;
import com.gentoro.deepresearch.exception.StateException;
import com.gentoro.deepresearch.ratelimit.RateLimitDecision;
import com.gentoro.deepresearch.ratelimit.SlidingWindowRateLimiter;
import com.gentoro.deepresearch.resilience.ResilienceService;
import com.gentoro.deepresearch.task.TaskManager;
import com.gentoro.deepresearch.task.TaskStatus;
import com.gentoro.deepresearch.task.TaskUpdate;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import org.slf4j.Logger;

/**
 * Runs research jobs (plan, search, write) on a worker pool.
 *
 * <ul>
 *   <li>Admission is gated per client by the rate limiter.
 *   <li>Every stage call goes through {@link ResilienceService#withResilience} under the stage's
 *       dependency name.
 *   <li>Plans and search results are shared through the cache.
 *   <li>Stage boundaries are reported to the {@link TaskManager}; an unrecovered failure marks the
 *       task failed with the error message.
 * </ul>
 */
public final class ResearchJobRunner implements AutoCloseable {
  private static final Logger log =
      com.gentoro.deepresearch.logging.LoggingService.getLogger(ResearchJobRunner.class);

  public static final String PLANNER = "planner";
  public static final String SEARCHER = "searcher";
  public static final String WRITER = "writer";

  private final ResearchStages stages;
  private final TtlCache<Object> cache;
  private final ResilienceService resilience;
  private final SlidingWindowRateLimiter rateLimiter;
  private final TaskManager tasks;
  private final PipelineSettings settings;
  private final ExecutorService executor;

  public ResearchJobRunner(
      ResearchStages stages,
      TtlCache<Object> cache,
      ResilienceService resilience,
      SlidingWindowRateLimiter rateLimiter,
      TaskManager tasks,
      PipelineSettings settings) {
    this.stages = stages;
    this.cache = cache;
    this.resilience = resilience;
    this.rateLimiter = rateLimiter;
    this.tasks = tasks;
    this.settings = settings;
    AtomicInteger counter = new AtomicInteger();
    this.executor =
        Executors.newFixedThreadPool(
            settings.workerThreads(),
            r -> {
              Thread t = new Thread(r, "research-worker-" + counter.incrementAndGet());
              t.setDaemon(true);
              return t;
            });
  }

  /**
   * Admit and start a research job for {@code clientKey}.
   *
   * @return the id of the task tracking the job
   * @throws RateLimitExceededException if the client exhausted its admissions for the window
   * @throws StateException if the runner has been closed
   */
  public String submit(String clientKey, String query) {
    if (executor.isShutdown()) {
      throw new StateException("Research job runner is closed");
    }
    RateLimitDecision decision = rateLimiter.checkRateLimit(clientKey);
    if (!decision.allowed()) {
      throw new RateLimitExceededException(clientKey, decision);
    }

    String taskId = UUID.randomUUID().toString();
    tasks.createTask(taskId);
    try {
      executor.submit(() -> run(taskId, query));
    } catch (RejectedExecutionException e) {
      // closed concurrently with this submission
      tasks.updateTask(taskId, TaskUpdate.failed("Research job runner is closed"));
      throw new StateException("Research job runner is closed", e);
    }
    log.info("Submitted research task {} for client {}", taskId, clientKey);
    return taskId;
  }

  private void run(String taskId, String query) {
    try {
      tasks.updateTask(taskId, TaskUpdate.stage(TaskStatus.PLANNING, "Planning searches...", 10));
      SearchPlan plan = plan(query);

      List<SearchItem> searches = plan.searches();
      tasks.updateTask(
          taskId,
          TaskUpdate.stage(
              TaskStatus.SEARCHING, "Running %d searches...".formatted(searches.size()), 30));
      List<String> results = new ArrayList<>(searches.size());
      for (int i = 0; i < searches.size(); i++) {
        SearchItem item = searches.get(i);
        int percent = 30 + (i * 35) / searches.size();
        tasks.updateTask(
            taskId,
            TaskUpdate.builder()
                .currentStep(
                    "Searching: %s (%d/%d)".formatted(item.query(), i + 1, searches.size()))
                .percent(percent)
                .build());
        results.add(search(item));
      }

      tasks.updateTask(taskId, TaskUpdate.stage(TaskStatus.WRITING, "Writing report...", 70));
      String report = resilience.withResilience(WRITER, () -> stages.write(query, results));

      tasks.updateTask(taskId, TaskUpdate.completed(report));
      log.info("Research task {} completed", taskId);
    } catch (Exception e) {
      log.error("Research task {} failed: {}", taskId, e.toString());
      tasks.updateTask(taskId, TaskUpdate.failed(ExceptionUtil.extractErrorMessage(e)));
    }
  }

  private SearchPlan plan(String query) throws Exception {
    Object cached =
        cache.getOrCompute(
            CacheKeys.generate("plan", query),
            () -> resilience.withResilience(PLANNER, () -> stages.plan(query)),
            settings.planTtl());
    return SearchPlan.class.cast(cached);
  }

  private String search(SearchItem item) throws Exception {
    Object cached =
        cache.getOrCompute(
            CacheKeys.generate("search", item.query()),
            () -> resilience.withResilience(SEARCHER, () -> stages.search(item)),
            settings.searchTtl());
    return String.class.cast(cached);
  }

  @Override
  public void close() {
    executor.shutdown();
    try {
      if (!executor.awaitTermination(5, TimeUnit.SECONDS)) {
        executor.shutdownNow();
      }
    } catch (InterruptedException e) {
      executor.shutdownNow();
      Thread.currentThread().interrupt();
    }
  }
}
