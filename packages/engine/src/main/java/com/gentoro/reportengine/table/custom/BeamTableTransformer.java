package com.gentoro.reportengine.table.custom;

import com.fasterxml.jackson.databind.JsonNode;
import com.gentoro.reportengine.table.FormatRules;
import com.gentoro.reportengine.table.TransformContext;
import com.gentoro.reportengine.utility.Values;
import java.util.ArrayList;
import java.util.List;

/**
 * Beam table: a fixed 3x2 grid whose second column holds the beam angle (row 1) and the peak
 * intensity (row 2), read from {@code extracted_data}. The first row is the template's header and
 * is left blank.
 *
 * <p>Parameters: {@code beam_angle_field} (default {@code beam_angle}), {@code
 * peak_intensity_field} ({@code peak_intensity}), {@code beam_angle_format} ({@code {:.1f}}),
 * {@code peak_intensity_format} ({@code {:.0f}}).
 */
public class BeamTableTransformer implements CustomTransformer {

  @Override
  public List<List<Object>> transform(
      List<List<Object>> grid, JsonNode params, TransformContext context) {
    JsonNode data = context.extractedData();
    if (!data.isObject() || data.isEmpty()) {
      return new ArrayList<>();
    }
    String beamField = TransformerParams.text(params, "beam_angle_field", "beam_angle");
    String intensityField =
        TransformerParams.text(params, "peak_intensity_field", "peak_intensity");
    String beamFormat = TransformerParams.text(params, "beam_angle_format", "{:.1f}");
    String intensityFormat = TransformerParams.text(params, "peak_intensity_format", "{:.0f}");

    String beam = FormatRules.renderValue(beamFormat, Values.fromJson(data.get(beamField)));
    String intensity =
        FormatRules.renderValue(intensityFormat, Values.fromJson(data.get(intensityField)));

    List<List<Object>> result = new ArrayList<>();
    result.add(new ArrayList<>(List.of("", "")));
    result.add(new ArrayList<>(List.of("", beam)));
    result.add(new ArrayList<>(List.of("", intensity)));
    return result;
  }
}
