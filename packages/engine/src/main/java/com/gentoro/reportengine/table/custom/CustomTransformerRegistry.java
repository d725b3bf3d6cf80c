package com.gentoro.reportengine.table.custom;

import com.fasterxml.jackson.databind.JsonNode;
import com.gentoro.reportengine.exception.ExceptionUtil;
import com.gentoro.reportengine.exception.ReportEngineErrorCode;
import com.gentoro.reportengine.exception.ReportEngineException;
import com.gentoro.reportengine.logging.LoggingService;
import com.gentoro.reportengine.table.Grids;
import com.gentoro.reportengine.table.TransformConfigException;
import com.gentoro.reportengine.table.TransformContext;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Registry of {@link CustomTransformer}s by name.
 *
 * <p>{@link #withBuiltins()} registers the transformers for the standard lighting report tables.
 * Registering an existing name replaces the previous transformer.
 */
public class CustomTransformerRegistry {

  private static final org.slf4j.Logger log =
      LoggingService.getLogger(CustomTransformerRegistry.class);

  private final Map<String, CustomTransformer> transformers = new LinkedHashMap<>();

  public static CustomTransformerRegistry withBuiltins() {
    CustomTransformerRegistry registry = new CustomTransformerRegistry();
    SummaryTableTransformer summary = new SummaryTableTransformer();
    return registry
        .register("photometric_data_transformer", summary)
        .register("statistical_summary", summary)
        .register("life_table_transformer", summary)
        .register("beam_table_transformer", new BeamTableTransformer())
        .register("eei_table_transformer", new EeiTableTransformer())
        .register("zone_table_transformer", new ZoneTableTransformer());
  }

  public CustomTransformerRegistry register(String name, CustomTransformer transformer) {
    if (name == null || name.isBlank()) {
      throw new IllegalArgumentException("Transformer name must not be blank");
    }
    transformers.put(name, Objects.requireNonNull(transformer, "transformer"));
    return this;
  }

  public Optional<CustomTransformer> get(String name) {
    return Optional.ofNullable(name == null ? null : transformers.get(name));
  }

  /** Registered names in registration order. */
  public List<String> list() {
    return new ArrayList<>(transformers.keySet());
  }

  /**
   * Run the named transformer on a copy of {@code grid}.
   *
   * @throws TransformConfigException when no transformer is registered under {@code name}
   * @throws ReportEngineException with {@code TRANSFORM_ERROR} when the transformer fails
   */
  public List<List<Object>> transform(
      String name, List<List<Object>> grid, JsonNode params, TransformContext context) {
    CustomTransformer transformer =
        get(name)
            .orElseThrow(() -> new TransformConfigException("Unknown transformer: " + name));
    log.debug("Running custom transformer '{}' on {} rows", name, grid.size());
    List<List<Object>> result;
    try {
      result =
          transformer.transform(
              Grids.copy(grid), params, context == null ? TransformContext.empty() : context);
    } catch (RuntimeException e) {
      throw ExceptionUtil.rethrowIfUnchecked(
          e,
          t ->
              new ReportEngineException(
                  ReportEngineErrorCode.TRANSFORM_ERROR,
                  "Transformer '%s' failed: %s".formatted(name, ExceptionUtil.rootMessage(t)),
                  t));
    }
    return Grids.copy(result);
  }
}
