package com.gentoro.deepresearch.management.endpoints;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.*;

import com.gentoro.deepresearch.ratelimit.RateLimiterStats;
import com.gentoro.deepresearch.ratelimit.SlidingWindowRateLimiter;
import org.eclipse.jetty.ee10.servlet.ServletHolder;
import org.eclipse.jetty.ee10.servlet.ServletTester;
import org.eclipse.jetty.http.HttpTester;
import org.junit.jupiter.api.*;

class RateLimitServletTest {

  private ServletTester tester;
  private SlidingWindowRateLimiter limiter;

  @BeforeEach
  void setUp() throws Exception {
    limiter = mock(SlidingWindowRateLimiter.class);
    tester = new ServletTester();
    tester.addServlet(new ServletHolder(new RateLimitServlet(limiter)), "/ratelimit/*");
    tester.start();
  }

  @AfterEach
  void tearDown() throws Exception {
    tester.stop();
  }

  private HttpTester.Response send(String method, String uri) throws Exception {
    HttpTester.Request req = HttpTester.newRequest();
    req.setMethod(method);
    req.setURI(uri);
    req.setVersion("HTTP/1.1");
    req.setHeader("Host", "tester");
    return HttpTester.parseResponse(tester.getResponses(req.generate()));
  }

  @Test
  void returnsStatsJson() throws Exception {
    when(limiter.getStats()).thenReturn(new RateLimiterStats(2, 7, 10, 60));

    HttpTester.Response resp = send("GET", "/ratelimit/stats");

    assertEquals(200, resp.getStatus());
    String body = resp.getContent();
    assertTrue(body.contains("\"active_clients\":2"), body);
    assertTrue(body.contains("\"total_requests_last_window\":7"), body);
    assertTrue(body.contains("\"requests_per_window_limit\":10"), body);
    assertTrue(body.contains("\"window_seconds\":60"), body);
  }

  @Test
  void unknownResourceIsNotFound() throws Exception {
    assertEquals(404, send("GET", "/ratelimit/other").getStatus());
  }

  @Test
  void deleteResetsClient() throws Exception {
    HttpTester.Response resp = send("DELETE", "/ratelimit/clients/10.0.0.7");

    assertEquals(204, resp.getStatus());
    verify(limiter).resetClient("10.0.0.7");
  }

  @Test
  void deleteWithoutClientIdIsBadRequest() throws Exception {
    assertEquals(400, send("DELETE", "/ratelimit/clients/").getStatus());
    verify(limiter, never()).resetClient(anyString());
  }
}
