package com.gentoro.deepresearch.management;

import com.gentoro.deepresearch.DeepResearch;
import com.gentoro.deepresearch.management.endpoints.BreakerStateServlet;
import com.gentoro.deepresearch.management.endpoints.CacheServlet;
import com.gentoro.deepresearch.management.endpoints.CacheStatsServlet;
import com.gentoro.deepresearch.management.endpoints.RateLimitServlet;
import com.gentoro.deepresearch.management.endpoints.TaskStatusServlet;
import org.eclipse.jetty.ee10.servlet.ServletContextHandler;
import org.eclipse.jetty.ee10.servlet.ServletHolder;

/**
 * Registers the read-only and administrative operator endpoints under {@code /mng}: cache stats
 * and clear, breaker states, rate limiter stats and client reset, task snapshots.
 */
public final class ManagementServer {

  private final DeepResearch deepResearch;

  public ManagementServer(DeepResearch deepResearch) {
    this.deepResearch = deepResearch;
  }

  private String contextPath() {
    return "/mng";
  }

  /** Register all management servlets with the Jetty context handler. */
  public void register() {
    ServletContextHandler ctx = deepResearch.httpServer().getContextHandler();

    ctx.addServlet(
        new ServletHolder(new CacheStatsServlet(deepResearch.cache())),
        "%s/cache/stats".formatted(contextPath()));
    ctx.addServlet(
        new ServletHolder(new CacheServlet(deepResearch.cache())),
        "%s/cache".formatted(contextPath()));

    ctx.addServlet(
        new ServletHolder(new BreakerStateServlet(deepResearch.resilience().breakers())),
        "%s/breakers".formatted(contextPath()));

    ctx.addServlet(
        new ServletHolder(new RateLimitServlet(deepResearch.rateLimiter())),
        "%s/ratelimit/*".formatted(contextPath()));

    ctx.addServlet(
        new ServletHolder(new TaskStatusServlet(deepResearch.tasks())),
        "%s/tasks/*".formatted(contextPath()));
  }
}
