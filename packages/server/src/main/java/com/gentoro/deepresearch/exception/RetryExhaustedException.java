package com.gentoro.deepresearch.exception;

/** All attempts against a dependency failed; the cause is the last captured failure. */
public class RetryExhaustedException extends DeepResearchException {
  private final String dependency;
  private final int attempts;

  public RetryExhaustedException(String dependency, int attempts, Throwable lastError) {
    super(
        DeepResearchErrorCode.RETRY_EXHAUSTED,
        "Dependency '%s' failed after %d attempts: %s"
            .formatted(dependency, attempts, ExceptionUtil.extractErrorMessage(lastError)),
        lastError);
    this.dependency = dependency;
    this.attempts = attempts;
    withContext("dependency", dependency);
    withContext("attempts", attempts);
  }

  public String getDependency() {
    return dependency;
  }

  public int getAttempts() {
    return attempts;
  }

  public Throwable getLastError() {
    return getCause();
  }
}
