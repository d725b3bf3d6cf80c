package com.gentoro.reportengine.exception;

/** Stable error codes attached to every {@link ReportEngineException}. */
public enum ReportEngineErrorCode {
  FIELD_NOT_FOUND,
  FUNCTION_NOT_FOUND,
  CALCULATION_ERROR,
  SAFE_EVAL_ERROR,
  TRANSFORM_ERROR,
  CONFIGURATION_ERROR,
  UNKNOWN
}
