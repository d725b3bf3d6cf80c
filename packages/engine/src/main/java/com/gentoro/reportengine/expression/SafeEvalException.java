package com.gentoro.reportengine.expression;

import com.gentoro.reportengine.exception.ReportEngineErrorCode;
import com.gentoro.reportengine.exception.ReportEngineException;

/**
 * Raised when a formula or format expression is rejected or fails to evaluate.
 *
 * <p>Every instance carries a {@link Kind}. Kinds other than {@link Kind#EXECUTION_FAILURE} are
 * raised before any part of the expression is evaluated.
 */
public class SafeEvalException extends ReportEngineException {

  public enum Kind {
    /** The text is not a well-formed expression. */
    SYNTAX_ERROR,
    /** Well-formed, but uses syntax outside the whitelist (attribute access, keywords, ...). */
    DISALLOWED_CONSTRUCT,
    /** Reference to a variable that is not bound. */
    UNDEFINED_NAME,
    /** Call to a function that is not on the allowed list. */
    UNDEFINED_FUNCTION,
    /** Nesting deeper than the configured limit. */
    TOO_COMPLEX,
    /** Valid expression that failed at runtime (type mismatch, bad format spec for a value). */
    EXECUTION_FAILURE
  }

  private final Kind kind;

  public SafeEvalException(Kind kind, String message) {
    super(ReportEngineErrorCode.SAFE_EVAL_ERROR, message);
    this.kind = kind;
    withContext("kind", kind.name());
  }

  public SafeEvalException(Kind kind, String message, Throwable cause) {
    super(ReportEngineErrorCode.SAFE_EVAL_ERROR, message, cause);
    this.kind = kind;
    withContext("kind", kind.name());
  }

  public Kind getKind() {
    return kind;
  }
}
