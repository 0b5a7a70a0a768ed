package com.gentoro.deepresearch.management.endpoints;

import com.gentoro.deepresearch.cache.TtlCache;
import jakarta.servlet.http.HttpServlet;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;

/** DELETE /mng/cache drops every cache entry and resets the counters. */
public final class CacheServlet extends HttpServlet {
  private static final org.slf4j.Logger log =
      com.gentoro.deepresearch.logging.LoggingService.getLogger(CacheServlet.class);

  private final TtlCache<?> cache;

  public CacheServlet(TtlCache<?> cache) {
    this.cache = cache;
  }

  @Override
  protected void doDelete(HttpServletRequest req, HttpServletResponse resp) {
    cache.clear();
    log.info("Cache cleared by operator request");
    resp.setStatus(204);
  }
}
