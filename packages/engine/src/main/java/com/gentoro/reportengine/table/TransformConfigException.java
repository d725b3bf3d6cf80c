package com.gentoro.reportengine.table;

import com.gentoro.reportengine.exception.ReportEngineErrorCode;
import com.gentoro.reportengine.exception.ReportEngineException;

/** A table transformation configuration is invalid: unknown step type, operation or transformer. */
public class TransformConfigException extends ReportEngineException {

  public TransformConfigException(String message) {
    super(ReportEngineErrorCode.TRANSFORM_ERROR, message);
  }

  public TransformConfigException(String message, Throwable cause) {
    super(ReportEngineErrorCode.TRANSFORM_ERROR, message, cause);
  }
}
