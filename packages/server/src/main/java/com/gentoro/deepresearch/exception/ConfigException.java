package com.gentoro.deepresearch.exception;

/** Invalid or unreadable configuration. */
public class ConfigException extends DeepResearchException {
  public ConfigException(String message) {
    super(DeepResearchErrorCode.CONFIG_ERROR, message);
  }

  public ConfigException(String message, Throwable cause) {
    super(DeepResearchErrorCode.CONFIG_ERROR, message, cause);
  }
}
