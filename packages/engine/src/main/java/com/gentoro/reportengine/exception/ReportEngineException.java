package com.gentoro.reportengine.exception;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Root of the engine's exception hierarchy.
 *
 * <p>Every failure raised by the engine carries a {@link ReportEngineErrorCode} and an optional
 * context map with structured details (field paths, function names, step types). Callers that only
 * need a human readable summary can use {@link ExceptionUtil#toErrorDetails(Throwable)}.
 */
public class ReportEngineException extends RuntimeException {

  private final ReportEngineErrorCode code;
  private final Map<String, Object> context = new LinkedHashMap<>();

  public ReportEngineException(ReportEngineErrorCode code, String message) {
    super(message);
    this.code = code;
  }

  public ReportEngineException(ReportEngineErrorCode code, String message, Throwable cause) {
    super(message, cause);
    this.code = code;
  }

  public ReportEngineErrorCode getCode() {
    return code;
  }

  /** Attach a structured detail to this exception; returns {@code this} for chaining. */
  public ReportEngineException withContext(String key, Object value) {
    context.put(key, value);
    return this;
  }

  public Map<String, Object> getContext() {
    return Collections.unmodifiableMap(context);
  }
}
