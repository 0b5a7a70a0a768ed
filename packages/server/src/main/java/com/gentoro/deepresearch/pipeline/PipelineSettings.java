package com.gentoro.deepresearch.pipeline;

import java.time.Duration;
import org.apache.commons.configuration2.Configuration;

public record PipelineSettings(int workerThreads, Duration planTtl, Duration searchTtl) {

  public static final PipelineSettings DEFAULTS =
      new PipelineSettings(4, Duration.ofHours(1), Duration.ofHours(2));

  public PipelineSettings {
    if (workerThreads <= 0) {
      throw new IllegalArgumentException("workerThreads must be positive: " + workerThreads);
    }
  }

  public static PipelineSettings fromConfiguration(Configuration config) {
    return new PipelineSettings(
        config.getInt("pipeline.worker-threads", DEFAULTS.workerThreads()),
        Duration.ofSeconds(
            config.getLong("pipeline.plan-ttl-seconds", DEFAULTS.planTtl().toSeconds())),
        Duration.ofSeconds(
            config.getLong("pipeline.search-ttl-seconds", DEFAULTS.searchTtl().toSeconds())));
  }
}
