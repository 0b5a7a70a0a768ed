package com.gentoro.deepresearch.exception;

import java.time.Instant;
import java.util.function.Function;

/** Utility helpers for dealing with exceptions and structured error details. */
public final class ExceptionUtil {
  private ExceptionUtil() {}

  /**
   * Convert any {@link Throwable} into {@link ErrorDetails} for logging or API responses. If the
   * throwable is a {@link DeepResearchException}, its code and context are preserved.
   */
  public static ErrorDetails toErrorDetails(Throwable t) {
    if (t instanceof DeepResearchException ex) {
      return new ErrorDetails(
          ex.getClass().getSimpleName(),
          safeMessage(ex.getMessage()),
          ex.getCode(),
          ex.getContext(),
          Instant.now());
    }
    return new ErrorDetails(
        t.getClass().getSimpleName(),
        safeMessage(t.getMessage()),
        DeepResearchErrorCode.UNKNOWN,
        null,
        Instant.now());
  }

  /**
   * Produce a compact, single-line representation of a throwable's stack trace, joining the top
   * frames in call-order.
   *
   * <p>Example output: {@code com.example.Foo.bar (Foo.java:42) > com.example.App.main
   * (App.java:10)}
   *
   * @param t the throwable whose stack should be summarized (null returns empty string)
   * @param maxFrames maximum number of top stack frames to include; if <= 0, includes all frames
   */
  public static String formatCompactStackTrace(Throwable t, int maxFrames) {
    if (t == null) return "";
    StackTraceElement[] elements = t.getStackTrace();
    if (elements == null || elements.length == 0) return "";

    int limit = maxFrames <= 0 ? elements.length : Math.min(elements.length, maxFrames);
    StringBuilder sb = new StringBuilder();
    for (int i = 0; i < limit; i++) {
      StackTraceElement e = elements[i];
      sb.append(e.getClassName())
          .append('.')
          .append(e.getMethodName())
          .append(" (")
          .append(e.getFileName() == null ? "Unknown Source" : e.getFileName());
      if (e.getLineNumber() >= 0) {
        sb.append(':').append(e.getLineNumber());
      }
      sb.append(')');
      if (i < limit - 1) sb.append(" > ");
    }
    return sb.toString();
  }

  /** Convenience overload using a reasonable default of 10 frames. */
  public static String formatCompactStackTrace(Throwable t) {
    return formatCompactStackTrace(t, 10);
  }

  /**
   * Extract a user-facing message from a throwable. Our own exceptions already carry a readable
   * message; for anything else the simple class name is prefixed so that bare messages such as
   * "timeout" stay meaningful.
   *
   * @return the error message, or a default message if none is available
   */
  public static String extractErrorMessage(Throwable t) {
    if (t == null) {
      return "Unknown error";
    }
    String message = t.getMessage();
    if (t instanceof DeepResearchException && message != null && !message.isBlank()) {
      return message;
    }
    String className = t.getClass().getSimpleName();
    if (message == null || message.isBlank()) {
      return className;
    }
    return className + ": " + message.trim();
  }

  /**
   * Return {@code t} unchanged when it is already one of our exceptions, otherwise wrap it with
   * {@code supplier}.
   */
  public static DeepResearchException rethrowIfUnchecked(
      Throwable t, Function<Throwable, DeepResearchException> supplier) {
    if (t instanceof DeepResearchException) {
      return (DeepResearchException) t;
    } else {
      return supplier.apply(t);
    }
  }

  private static String safeMessage(String message) {
    return message == null ? "" : message;
  }
}
