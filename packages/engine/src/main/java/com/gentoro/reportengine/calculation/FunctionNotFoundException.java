package com.gentoro.reportengine.calculation;

import com.gentoro.reportengine.exception.ReportEngineErrorCode;

/** A mapping references a function name that is not registered. */
public class FunctionNotFoundException extends CalculatorException {

  private final String functionName;

  public FunctionNotFoundException(String functionName) {
    super(ReportEngineErrorCode.FUNCTION_NOT_FOUND, "Function not found: " + functionName);
    this.functionName = functionName;
    withContext("function", functionName);
  }

  public String getFunctionName() {
    return functionName;
  }
}
