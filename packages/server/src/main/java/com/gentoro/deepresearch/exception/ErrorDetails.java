package com.gentoro.deepresearch.exception;

import java.time.Instant;
import java.util.Map;

/** Structured view of an error, suitable for logging or JSON responses. */
public record ErrorDetails(
    String type,
    String message,
    DeepResearchErrorCode code,
    Map<String, Object> context,
    Instant timestamp) {}
