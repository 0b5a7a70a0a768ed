package com.gentoro.deepresearch.task;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.gentoro.deepresearch.utility.JacksonUtility;

/**
 * One outbound stream event: either a {@code progress} event whose data is the snapshot JSON, or a
 * {@code ping} keepalive with empty data.
 */
public record ProgressEvent(String name, String data) {
  public static final String PROGRESS = "progress";
  public static final String PING = "ping";

  public static ProgressEvent progress(TaskProgress snapshot) {
    try {
      return new ProgressEvent(PROGRESS, JacksonUtility.getJsonMapper().writeValueAsString(snapshot));
    } catch (JsonProcessingException e) {
      throw new IllegalStateException("Could not serialize snapshot of " + snapshot.taskId(), e);
    }
  }

  public static ProgressEvent ping() {
    return new ProgressEvent(PING, "");
  }

  public boolean isKeepalive() {
    return PING.equals(name);
  }
}
