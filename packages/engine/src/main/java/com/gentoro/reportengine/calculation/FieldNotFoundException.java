package com.gentoro.reportengine.calculation;

import com.gentoro.reportengine.exception.ReportEngineErrorCode;
import java.util.List;
import java.util.Map;

/**
 * An argument path could not be resolved in the report. The message lists the field names
 * available in each report section to help fix the mapping.
 */
public class FieldNotFoundException extends CalculatorException {

  private final String fieldPath;
  private final Map<String, List<String>> availableFields;

  public FieldNotFoundException(String fieldPath, Map<String, List<String>> availableFields) {
    super(ReportEngineErrorCode.FIELD_NOT_FOUND, buildMessage(fieldPath, availableFields));
    this.fieldPath = fieldPath;
    this.availableFields = availableFields == null ? Map.of() : Map.copyOf(availableFields);
    withContext("field", fieldPath);
  }

  public String getFieldPath() {
    return fieldPath;
  }

  public Map<String, List<String>> getAvailableFields() {
    return availableFields;
  }

  private static String buildMessage(String fieldPath, Map<String, List<String>> available) {
    String message = "Field not found: " + fieldPath;
    if (available != null && !available.isEmpty()) {
      message += "\nAvailable fields: " + available;
    }
    return message;
  }
}
