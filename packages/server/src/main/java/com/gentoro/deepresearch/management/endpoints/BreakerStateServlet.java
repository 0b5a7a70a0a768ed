package com.gentoro.deepresearch.management.endpoints;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.gentoro.deepresearch.resilience.CircuitBreakerRegistry;
import com.gentoro.deepresearch.utility.JacksonUtility;
import jakarta.servlet.http.HttpServlet;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import java.io.IOException;

/** GET /mng/breakers returns the state of every circuit breaker keyed by dependency name. */
public final class BreakerStateServlet extends HttpServlet {
  private final CircuitBreakerRegistry breakers;
  private final ObjectMapper mapper = JacksonUtility.getJsonMapper();

  public BreakerStateServlet(CircuitBreakerRegistry breakers) {
    this.breakers = breakers;
  }

  @Override
  protected void doGet(HttpServletRequest req, HttpServletResponse resp) throws IOException {
    resp.setStatus(200);
    resp.setContentType("application/json");
    resp.getWriter().write(mapper.writeValueAsString(breakers.getAllStates()));
  }
}
