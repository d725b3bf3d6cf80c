package com.gentoro.reportengine.calculation;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * One entry of the {@code field_mappings} configuration.
 *
 * <pre>{@code
 * {
 *   "template_field": "energy_class",
 *   "source_field": "calculated_data.energy_class",
 *   "type": "text",
 *   "function": "energy_class_rating",
 *   "args": ["extracted_data.rated_wattage", "extracted_data.useful_luminous_flux"]
 * }
 * }</pre>
 *
 * Only mappings with a {@code function} are computed in batch mode.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record FieldMapping(
    @JsonProperty("template_field") String templateField,
    @JsonProperty("source_field") String sourceField,
    @JsonProperty("type") String type,
    @JsonProperty("function") String function,
    @JsonProperty("args") List<String> args) {

  public FieldMapping {
    args = args == null ? List.of() : Collections.unmodifiableList(new ArrayList<>(args));
  }

  public boolean hasFunction() {
    return function != null && !function.isBlank();
  }

  public boolean isType(String expected) {
    return type != null && type.equalsIgnoreCase(expected);
  }
}
