package com.gentoro.reportengine.processor;

import com.fasterxml.jackson.databind.node.ObjectNode;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Output of {@link ReportDataProcessor}: what a document template is filled with.
 *
 * @param values rendered scalar values keyed by template field
 * @param tables transformed grids keyed by template field
 * @param report the report after calculation, including {@code calculated_data}
 */
public record ProcessedReport(
    Map<String, String> values, Map<String, List<List<Object>>> tables, ObjectNode report) {

  public ProcessedReport {
    values = Collections.unmodifiableMap(new LinkedHashMap<>(values));
    tables = Collections.unmodifiableMap(new LinkedHashMap<>(tables));
  }

  public String value(String templateField) {
    return values.get(templateField);
  }

  public List<List<Object>> table(String templateField) {
    return tables.get(templateField);
  }
}
