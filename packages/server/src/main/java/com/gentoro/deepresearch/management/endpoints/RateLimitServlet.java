package com.gentoro.deepresearch.management.endpoints;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.gentoro.deepresearch.ratelimit.SlidingWindowRateLimiter;
import com.gentoro.deepresearch.utility.JacksonUtility;
import jakarta.servlet.http.HttpServlet;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import java.io.IOException;

/**
 * GET /mng/ratelimit/stats returns limiter statistics. DELETE /mng/ratelimit/clients/{id} purges
 * one client's request history.
 */
public final class RateLimitServlet extends HttpServlet {
  private static final String CLIENTS_PREFIX = "/clients/";

  private final SlidingWindowRateLimiter limiter;
  private final ObjectMapper mapper = JacksonUtility.getJsonMapper();

  public RateLimitServlet(SlidingWindowRateLimiter limiter) {
    this.limiter = limiter;
  }

  @Override
  protected void doGet(HttpServletRequest req, HttpServletResponse resp) throws IOException {
    if (!"/stats".equals(req.getPathInfo())) {
      resp.sendError(404, "Unknown resource");
      return;
    }
    resp.setStatus(200);
    resp.setContentType("application/json");
    resp.getWriter().write(mapper.writeValueAsString(limiter.getStats()));
  }

  @Override
  protected void doDelete(HttpServletRequest req, HttpServletResponse resp) throws IOException {
    String path = req.getPathInfo();
    if (path == null
        || !path.startsWith(CLIENTS_PREFIX)
        || path.length() <= CLIENTS_PREFIX.length()) {
      resp.sendError(400, "Missing client id");
      return;
    }
    limiter.resetClient(path.substring(CLIENTS_PREFIX.length()));
    resp.setStatus(204);
  }
}
