package com.gentoro.deepresearch.exception;

/** Failure to bind or run a network listener. */
public class NetworkException extends DeepResearchException {
  public NetworkException(String message, Throwable cause) {
    super(DeepResearchErrorCode.NETWORK_ERROR, message, cause);
  }
}
