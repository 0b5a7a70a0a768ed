package com.gentoro.deepresearch;

public class DeepResearchApp {

  private static final org.slf4j.Logger log =
      com.gentoro.deepresearch.logging.LoggingService.getLogger(DeepResearchApp.class);

  public static void main(String[] args) {
    try {
      DeepResearch app = new DeepResearch(args);
      app.initialize();
      // Keep the management endpoints running until shutdown signal
      app.waitShutdownSignal();
    } catch (Exception e) {
      log.error("Application failed to start", e);
      System.exit(1);
    }
  }
}
