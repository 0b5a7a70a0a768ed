package com.gentoro.deepresearch;

import com.gentoro.deepresearch.cache.TtlCache;
import com.gentoro.deepresearch.exception.ExceptionUtil;
import com.gentoro.deepresearch.exception.NetworkException;
import com.gentoro.deepresearch.exception.StateException;
import com.gentoro.deepresearch.http.EmbeddedJettyServer;
import com.gentoro.deepresearch.management.ManagementServer;
import com.gentoro.deepresearch.pipeline.PipelineSettings;
import com.gentoro.deepresearch.pipeline.ResearchJobRunner;
import com.gentoro.deepresearch.pipeline.ResearchStages;
import com.gentoro.deepresearch.ratelimit.SlidingWindowRateLimiter;
import com.gentoro.deepresearch.resilience.CircuitBreakerRegistry;
import com.gentoro.deepresearch.resilience.CircuitBreakerSettings;
import com.gentoro.deepresearch.resilience.ResilienceService;
import com.gentoro.deepresearch.resilience.RetryExecutor;
import com.gentoro.deepresearch.resilience.RetryPolicy;
import com.gentoro.deepresearch.task.ProgressStream;
import com.gentoro.deepresearch.task.TaskManager;
import java.time.Clock;
import java.time.Duration;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import org.apache.commons.configuration2.Configuration;

/**
 * Owns the process-wide research core: constructs the cache, breakers, rate limiter and task
 * manager once from configuration, schedules their periodic maintenance and exposes them to the
 * pipeline and the management endpoints. Nothing here is a static singleton.
 */
public class DeepResearch {

  private static final org.slf4j.Logger log =
      com.gentoro.deepresearch.logging.LoggingService.getLogger(DeepResearch.class);

  private final StartupParameters startupParameters;
  private final Clock clock;
  private ConfigurationProvider configurationProvider;
  private TtlCache<Object> cache;
  private ResilienceService resilience;
  private SlidingWindowRateLimiter rateLimiter;
  private TaskManager tasks;
  private ProgressStream progressStream;
  private PipelineSettings pipelineSettings;
  private EmbeddedJettyServer httpServer;
  private ScheduledExecutorService maintenance;
  private final List<ResearchJobRunner> runners = new CopyOnWriteArrayList<>();
  private final AtomicBoolean shuttingDown = new AtomicBoolean(false);
  private final CountDownLatch shutdownLatch = new CountDownLatch(1);
  private volatile Thread shutdownHook;

  public DeepResearch(String[] applicationArgs) {
    this(applicationArgs, Clock.systemUTC());
  }

  public DeepResearch(String[] applicationArgs, Clock clock) {
    this.startupParameters = new StartupParameters(applicationArgs);
    this.clock = clock;
  }

  public void initialize() {
    this.configurationProvider = new ConfigurationProvider(startupParameters.configFile());
    // Apply logging levels from configuration as early as possible
    com.gentoro.deepresearch.logging.LoggingService.applyConfiguration(configuration());
    Configuration config = configuration();

    this.cache =
        new TtlCache<>(
            config.getInt("cache.max-size", 1000),
            Duration.ofSeconds(config.getLong("cache.default-ttl-seconds", 3600)),
            clock);

    CircuitBreakerRegistry breakers =
        new CircuitBreakerRegistry(CircuitBreakerSettings.fromConfiguration(config), clock);
    breakers.registerAll(
        config.getList(
            String.class,
            "breaker.dependencies",
            List.of(
                ResearchJobRunner.PLANNER, ResearchJobRunner.SEARCHER, ResearchJobRunner.WRITER)));
    this.resilience =
        new ResilienceService(
            breakers, new RetryExecutor(), RetryPolicy.fromConfiguration(config));

    this.rateLimiter = SlidingWindowRateLimiter.fromConfiguration(config, clock);
    this.tasks = new TaskManager(clock);
    this.progressStream =
        new ProgressStream(
            tasks, Duration.ofSeconds(config.getLong("tasks.keepalive-seconds", 30)));
    this.pipelineSettings = PipelineSettings.fromConfiguration(config);

    scheduleMaintenance(config);

    if (config.getBoolean("http.enabled", true)) {
      this.httpServer = new EmbeddedJettyServer(config);
      httpServer.prepare();
      try {
        new ManagementServer(this).register();
        httpServer.start();
      } catch (Exception e) {
        shutdown();
        throw ExceptionUtil.rethrowIfUnchecked(
            e, ex -> new NetworkException("Could not start http server", ex));
      }
    }
    log.info(
        "Deep research core initialized (cache size {}, rate limit {}/window)",
        cache.maxSize(),
        rateLimiter.limit());
  }

  private void scheduleMaintenance(Configuration config) {
    long cacheInterval = config.getLong("cache.cleanup-interval-seconds", 300);
    long taskInterval = config.getLong("tasks.cleanup-interval-seconds", 300);
    Duration maxTaskAge = Duration.ofMinutes(config.getLong("tasks.max-age-minutes", 60));

    this.maintenance =
        Executors.newSingleThreadScheduledExecutor(
            r -> {
              Thread t = new Thread(r, "research-maintenance");
              t.setDaemon(true);
              return t;
            });
    maintenance.scheduleAtFixedRate(
        guarded("cache cleanup", cache::cleanupExpired),
        cacheInterval,
        cacheInterval,
        TimeUnit.SECONDS);
    maintenance.scheduleAtFixedRate(
        guarded("task cleanup", () -> tasks.cleanupOldTasks(maxTaskAge)),
        taskInterval,
        taskInterval,
        TimeUnit.SECONDS);
  }

  // A scheduled task that throws is never run again, so failures are logged and swallowed here.
  private static Runnable guarded(String name, Runnable job) {
    return () -> {
      try {
        job.run();
      } catch (RuntimeException e) {
        log.warn("Maintenance job '{}' failed: {}", name, e.toString());
      }
    };
  }

  /**
   * Create a job runner bound to this core. The runner's worker pool is shut down together with
   * this instance.
   */
  public ResearchJobRunner createJobRunner(ResearchStages stages) {
    ensureInitialized();
    ResearchJobRunner runner =
        new ResearchJobRunner(stages, cache, resilience, rateLimiter, tasks, pipelineSettings);
    runners.add(runner);
    return runner;
  }

  /**
   * Block the current thread until a shutdown signal is received (e.g., Ctrl+C or JVM termination).
   */
  public void waitShutdownSignal() {
    if (shutdownHook == null) {
      synchronized (this) {
        if (shutdownHook == null) {
          shutdownHook = new Thread(this::shutdown, "deepresearch-shutdown-hook");
          Runtime.getRuntime().addShutdownHook(shutdownHook);
        }
      }
    }

    try {
      shutdownLatch.await();
    } catch (InterruptedException ie) {
      Thread.currentThread().interrupt();
    }
  }

  /** Release resources. Safe to call multiple times; executed only once. */
  public void shutdown() {
    if (!shuttingDown.compareAndSet(false, true)) {
      return;
    }
    try {
      runners.forEach(ResearchJobRunner::close);
      if (maintenance != null) {
        maintenance.shutdownNow();
      }
      if (httpServer != null) {
        httpServer.close();
      }
      log.info("Deep research core stopped");
    } finally {
      shutdownLatch.countDown();
    }
  }

  public boolean isShutdown() {
    return shuttingDown.get();
  }

  /** Expose the application configuration to other components. */
  public Configuration configuration() {
    if (configurationProvider == null) {
      throw new StateException("DeepResearch not initialized. Call initialize() first.");
    }
    return configurationProvider.config();
  }

  private void ensureInitialized() {
    if (tasks == null) {
      throw new StateException("DeepResearch not initialized. Call initialize() first.");
    }
  }

  public StartupParameters startupParameters() {
    return startupParameters;
  }

  public TtlCache<Object> cache() {
    return cache;
  }

  public ResilienceService resilience() {
    return resilience;
  }

  public SlidingWindowRateLimiter rateLimiter() {
    return rateLimiter;
  }

  public TaskManager tasks() {
    return tasks;
  }

  public ProgressStream progressStream() {
    return progressStream;
  }

  public EmbeddedJettyServer httpServer() {
    return httpServer;
  }
}
