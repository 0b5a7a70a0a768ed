package com.gentoro.deepresearch.task;

import java.io.IOException;

/** Outbound side of a progress stream, typically a server-sent-events response. */
public interface ProgressSink {
  /** Forward one event. An {@link IOException} ends the stream. */
  void send(ProgressEvent event) throws IOException;

  default boolean isOpen() {
    return true;
  }
}
