package com.gentoro.reportengine.table.custom;

import com.fasterxml.jackson.databind.JsonNode;
import com.gentoro.reportengine.table.TransformContext;
import java.util.List;

/**
 * A named, table-specific transformation invoked by {@code custom_transform} steps.
 *
 * <p>Implementations must not modify {@code grid}; they return a new grid. Transformers that build
 * their table from report fields rather than from the incoming grid read {@link
 * TransformContext#extractedData()}.
 */
@FunctionalInterface
public interface CustomTransformer {

  /**
   * @param grid the grid entering the step
   * @param params the whole step configuration object
   * @param context report data available to the transformation
   */
  List<List<Object>> transform(List<List<Object>> grid, JsonNode params, TransformContext context);
}
