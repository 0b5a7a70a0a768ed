package com.gentoro.deepresearch.exception;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/** Base runtime exception for the research core. Carries an error code and optional context. */
public class DeepResearchException extends RuntimeException {
  private final DeepResearchErrorCode code;
  private final Map<String, Object> context = new LinkedHashMap<>();

  public DeepResearchException(DeepResearchErrorCode code, String message) {
    super(message);
    this.code = code;
  }

  public DeepResearchException(DeepResearchErrorCode code, String message, Throwable cause) {
    super(message, cause);
    this.code = code;
  }

  public DeepResearchErrorCode getCode() {
    return code;
  }

  public Map<String, Object> getContext() {
    return Collections.unmodifiableMap(context);
  }

  /** Attach a context value and return this exception for chaining. */
  public DeepResearchException withContext(String key, Object value) {
    context.put(key, value);
    return this;
  }
}
