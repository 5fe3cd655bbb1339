package com.gentoro.scenarios.exception;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.gentoro.scenarios.utility.JacksonUtility;
import java.time.Instant;
import java.util.StringJoiner;

/** Utility helpers for dealing with exceptions and structured error details. */
public final class ExceptionUtil {
  static final String ENGINE_PACKAGE = "com.gentoro.scenarios.";

  private ExceptionUtil() {}

  /**
   * Convert any {@link Throwable} into {@link ErrorDetails} for logging. If the throwable is a
   * {@link ScenarioException}, its code and context are preserved.
   */
  public static ErrorDetails toErrorDetails(Throwable t) {
    if (t instanceof ScenarioException ex) {
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
        ScenarioErrorCode.UNKNOWN,
        null,
        Instant.now());
  }

  /** Render {@link #toErrorDetails(Throwable)} as a single JSON line. */
  public static String toJson(Throwable t) {
    ErrorDetails details = toErrorDetails(t);
    try {
      return JacksonUtility.getJsonMapper().writeValueAsString(details);
    } catch (JsonProcessingException e) {
      return details.type() + ": " + details.message();
    }
  }

  /**
   * One-line summary of where {@code t} was thrown inside the engine. Frames are taken from the
   * top down to the last frame of the first run of {@code com.gentoro.scenarios} frames, so the
   * host's callers are left out, e.g. {@code
   * java.lang.Long.parseLong (Long.java:692) > com.gentoro.scenarios.setup.Scenario.run
   * (Scenario.java:77)}.
   *
   * @param maxFrames upper bound on the frames included; {@code <= 0} for no bound
   */
  public static String formatCompactStackTrace(Throwable t, int maxFrames) {
    if (t == null) return "";
    StackTraceElement[] elements = t.getStackTrace();
    if (elements == null || elements.length == 0) return "";

    StringJoiner trace = new StringJoiner(" > ");
    boolean inEngine = false;
    int frames = 0;
    for (StackTraceElement e : elements) {
      boolean engineFrame = e.getClassName().startsWith(ENGINE_PACKAGE);
      if (inEngine && !engineFrame) break;
      if (maxFrames > 0 && frames == maxFrames) break;
      inEngine |= engineFrame;
      trace.add(frame(e));
      frames++;
    }
    return trace.toString();
  }

  public static String formatCompactStackTrace(Throwable t) {
    return formatCompactStackTrace(t, 10);
  }

  private static String frame(StackTraceElement e) {
    String file = e.getFileName() == null ? "Unknown Source" : e.getFileName();
    String line = e.getLineNumber() >= 0 ? ":" + e.getLineNumber() : "";
    return "%s.%s (%s%s)".formatted(e.getClassName(), e.getMethodName(), file, line);
  }

  private static String safeMessage(String message) {
    return message == null ? "" : message;
  }
}
