package com.gentoro.reportengine.calculation;

import com.gentoro.reportengine.exception.ReportEngineErrorCode;
import com.gentoro.reportengine.exception.ReportEngineException;

/** Failure while computing a calculated field. */
public class CalculatorException extends ReportEngineException {

  public CalculatorException(String message) {
    super(ReportEngineErrorCode.CALCULATION_ERROR, message);
  }

  public CalculatorException(String message, Throwable cause) {
    super(ReportEngineErrorCode.CALCULATION_ERROR, message, cause);
  }

  protected CalculatorException(ReportEngineErrorCode code, String message) {
    super(code, message);
  }
}
