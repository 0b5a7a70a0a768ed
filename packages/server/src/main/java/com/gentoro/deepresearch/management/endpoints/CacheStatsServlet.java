package com.gentoro.deepresearch.management.endpoints;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.gentoro.deepresearch.cache.TtlCache;
import com.gentoro.deepresearch.utility.JacksonUtility;
import jakarta.servlet.http.HttpServlet;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import java.io.IOException;

/** GET /mng/cache/stats returns cache statistics. */
public final class CacheStatsServlet extends HttpServlet {
  private final TtlCache<?> cache;
  private final ObjectMapper mapper = JacksonUtility.getJsonMapper();

  public CacheStatsServlet(TtlCache<?> cache) {
    this.cache = cache;
  }

  @Override
  protected void doGet(HttpServletRequest req, HttpServletResponse resp) throws IOException {
    resp.setStatus(200);
    resp.setContentType("application/json");
    resp.getWriter().write(mapper.writeValueAsString(cache.getStats()));
  }
}
