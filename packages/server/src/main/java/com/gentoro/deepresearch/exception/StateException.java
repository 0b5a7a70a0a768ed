package com.gentoro.deepresearch.exception;

/** A component was used in a lifecycle state that does not allow the operation. */
public class StateException extends DeepResearchException {
  public StateException(String message) {
    super(DeepResearchErrorCode.STATE_ERROR, message);
  }

  public StateException(String message, Throwable cause) {
    super(DeepResearchErrorCode.STATE_ERROR, message, cause);
  }
}
