package com.gentoro.deepresearch.pipeline;

import static org.junit.jupiter.api.Assertions.*;

import com.gentoro.deepresearch.cache.TtlCache;
import com.gentoro.deepresearch.exception.RateLimitExceededException;
import com.gentoro.deepresearch.exception.StateException;
import com.gentoro.deepresearch.ratelimit.SlidingWindowRateLimiter;
import com.gentoro.deepresearch.resilience.CircuitBreakerRegistry;
import com.gentoro.deepresearch.resilience.CircuitBreakerSettings;
import com.gentoro.deepresearch.resilience.ResilienceService;
import com.gentoro.deepresearch.resilience.RetryExecutor;
import com.gentoro.deepresearch.resilience.RetryPolicy;
import com.gentoro.deepresearch.task.TaskManager;
import com.gentoro.deepresearch.task.TaskProgress;
import com.gentoro.deepresearch.task.TaskStatus;
import com.gentoro.deepresearch.task.TaskSubscription;
import java.io.IOException;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class ResearchJobRunnerTest {

  static class FakeStages implements ResearchStages {
    final AtomicInteger plans = new AtomicInteger();
    final AtomicInteger searches = new AtomicInteger();
    final AtomicInteger writes = new AtomicInteger();
    final CountDownLatch planGate = new CountDownLatch(1);
    volatile boolean searchBackendDown;

    @Override
    public SearchPlan plan(String query) throws Exception {
      assertTrue(planGate.await(5, TimeUnit.SECONDS));
      plans.incrementAndGet();
      return new SearchPlan(
          List.of(
              new SearchItem(query + " history", "background"),
              new SearchItem(query + " latest news", "recent developments")));
    }

    @Override
    public String search(SearchItem item) throws Exception {
      searches.incrementAndGet();
      if (searchBackendDown) {
        throw new IOException("search backend down");
      }
      return "summary of " + item.query();
    }

    @Override
    public String write(String query, List<String> searchResults) {
      writes.incrementAndGet();
      return "# " + query + "\n\n" + String.join("\n", searchResults);
    }
  }

  private final FakeStages stages = new FakeStages();
  private TaskManager tasks;
  private ResearchJobRunner runner;

  @BeforeEach
  void setUp() {
    tasks = new TaskManager();
    runner = newRunner(new SlidingWindowRateLimiter(10));
  }

  @AfterEach
  void tearDown() {
    runner.close();
  }

  private ResearchJobRunner newRunner(SlidingWindowRateLimiter limiter) {
    ResilienceService resilience =
        new ResilienceService(
            new CircuitBreakerRegistry(new CircuitBreakerSettings(5, Duration.ofSeconds(60))),
            new RetryExecutor(delay -> {}),
            new RetryPolicy(1, Duration.ofMillis(1), Duration.ofMillis(1), 2.0));
    return new ResearchJobRunner(
        stages,
        new TtlCache<>(100, Duration.ofMinutes(10)),
        resilience,
        limiter,
        tasks,
        new PipelineSettings(1, Duration.ofMinutes(10), Duration.ofMinutes(10)));
  }

  private TaskProgress awaitTerminal(String taskId) throws InterruptedException {
    long deadline = System.currentTimeMillis() + 5000;
    while (System.currentTimeMillis() < deadline) {
      TaskProgress snapshot = tasks.getTask(taskId).orElseThrow();
      if (snapshot.status().isTerminal()) {
        return snapshot;
      }
      Thread.sleep(10);
    }
    fail("task " + taskId + " did not finish");
    return null;
  }

  @Test
  void completedJobReportsStagesInOrder() throws Exception {
    String taskId = runner.submit("client", "Fusion power");
    TaskSubscription subscription = tasks.subscribe(taskId).orElseThrow();
    stages.planGate.countDown();

    List<TaskProgress> seen = new ArrayList<>();
    while (seen.isEmpty() || !seen.get(seen.size() - 1).status().isTerminal()) {
      Optional<TaskProgress> next = subscription.poll(Duration.ofSeconds(5));
      assertTrue(next.isPresent(), "timed out waiting for progress");
      seen.add(next.get());
    }

    TaskProgress done = seen.get(seen.size() - 1);
    assertEquals(TaskStatus.COMPLETED, done.status());
    assertEquals(100, done.percent());
    assertTrue(done.result().startsWith("# Fusion power"));
    assertTrue(done.result().contains("summary of Fusion power latest news"));

    List<Integer> percents = seen.stream().map(TaskProgress::percent).toList();
    for (int i = 1; i < percents.size(); i++) {
      assertTrue(percents.get(i) >= percents.get(i - 1), "percent went backwards: " + percents);
    }
    assertTrue(percents.containsAll(List.of(30, 47, 70, 100)), percents.toString());
    assertTrue(seen.stream().anyMatch(p -> p.status() == TaskStatus.WRITING));
  }

  @Test
  void repeatedQueryIsServedFromCache() throws Exception {
    stages.planGate.countDown();

    awaitTerminal(runner.submit("client", "Fusion power"));
    TaskProgress second = awaitTerminal(runner.submit("client", "  fusion POWER "));

    assertEquals(TaskStatus.COMPLETED, second.status());
    assertEquals(1, stages.plans.get());
    assertEquals(2, stages.searches.get());
    assertEquals(2, stages.writes.get());
  }

  @Test
  void unrecoveredFailureMarksTaskFailed() throws Exception {
    stages.searchBackendDown = true;
    stages.planGate.countDown();

    TaskProgress failed = awaitTerminal(runner.submit("client", "Fusion power"));

    assertEquals(TaskStatus.FAILED, failed.status());
    assertTrue(failed.error().contains("searcher"), failed.error());
    assertTrue(failed.error().contains("search backend down"), failed.error());
    assertNull(failed.result());
    // one attempt plus one retry
    assertEquals(2, stages.searches.get());
    assertEquals(0, stages.writes.get());
  }

  @Test
  void closedRunnerRejectsSubmissionsWithoutCreatingTasks() {
    SlidingWindowRateLimiter limiter = new SlidingWindowRateLimiter(10);
    runner.close();
    runner = newRunner(limiter);
    runner.close();

    assertThrows(StateException.class, () -> runner.submit("client", "late query"));
    assertEquals(0, tasks.taskCount());
    assertEquals(10, limiter.getRemaining("client"));
  }

  @Test
  void submissionsBeyondTheRateLimitAreRejected() {
    runner.close();
    runner = newRunner(new SlidingWindowRateLimiter(1));
    stages.planGate.countDown();

    runner.submit("client", "first");
    RateLimitExceededException ex =
        assertThrows(RateLimitExceededException.class, () -> runner.submit("client", "second"));

    assertFalse(ex.getDecision().allowed());
    assertTrue(ex.getDecision().retryAfterSeconds() > 0);
    assertEquals(1, tasks.taskCount());
  }
}
