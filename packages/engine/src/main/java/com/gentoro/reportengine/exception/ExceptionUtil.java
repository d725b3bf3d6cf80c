package com.gentoro.reportengine.exception;

import java.time.Instant;
import java.util.Arrays;
import java.util.function.Function;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/** Helpers for turning engine failures into log-friendly text and structured details. */
public final class ExceptionUtil {

  private static final int DEFAULT_FRAMES = 5;

  private ExceptionUtil() {}

  /** Flatten {@code t}; engine exceptions keep their code and context, others map to UNKNOWN. */
  public static ErrorDetails toErrorDetails(Throwable t) {
    String message = t.getMessage() == null ? "" : t.getMessage();
    if (t instanceof ReportEngineException engine) {
      return new ErrorDetails(
          t.getClass().getSimpleName(),
          message,
          engine.getCode(),
          engine.getContext(),
          Instant.now());
    }
    return new ErrorDetails(
        t.getClass().getSimpleName(), message, ReportEngineErrorCode.UNKNOWN, null, Instant.now());
  }

  /**
   * Top {@code maxFrames} stack frames on one line, innermost first and separated by {@code " > "}.
   * A non-positive {@code maxFrames} keeps every frame.
   */
  public static String formatCompactStackTrace(Throwable t, int maxFrames) {
    if (t == null || t.getStackTrace() == null) {
      return "";
    }
    Stream<StackTraceElement> frames = Arrays.stream(t.getStackTrace());
    if (maxFrames > 0) {
      frames = frames.limit(maxFrames);
    }
    return frames.map(ExceptionUtil::frame).collect(Collectors.joining(" > "));
  }

  public static String formatCompactStackTrace(Throwable t) {
    return formatCompactStackTrace(t, DEFAULT_FRAMES);
  }

  private static String frame(StackTraceElement e) {
    String file = e.getFileName() == null ? "Unknown Source" : e.getFileName();
    String line = e.getLineNumber() >= 0 ? ":" + e.getLineNumber() : "";
    return e.getClassName() + "." + e.getMethodName() + " (" + file + line + ")";
  }

  /**
   * Message of the innermost cause that has one, falling back to the class name. Used when an
   * engine exception wraps a failure raised by caller-supplied code.
   */
  public static String rootMessage(Throwable t) {
    if (t == null) {
      return "Unknown error";
    }
    String message = null;
    for (Throwable current = t; current != null; current = next(current)) {
      if (current.getMessage() != null && !current.getMessage().isBlank()) {
        message = current.getMessage();
      }
    }
    return message == null ? t.getClass().getSimpleName() : message;
  }

  private static Throwable next(Throwable t) {
    return t.getCause() == t ? null : t.getCause();
  }

  /** Return engine exceptions as they are; wrap anything else with {@code wrapper}. */
  public static ReportEngineException rethrowIfUnchecked(
      Throwable t, Function<Throwable, ReportEngineException> wrapper) {
    return t instanceof ReportEngineException engine ? engine : wrapper.apply(t);
  }
}
