package com.gentoro.reportengine.table.custom;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;

import com.fasterxml.jackson.databind.JsonNode;
import com.gentoro.reportengine.table.TransformConfigException;
import com.gentoro.reportengine.table.TransformContext;
import com.gentoro.reportengine.utility.JacksonUtility;
import java.util.ArrayList;
import java.util.List;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

/** Unit tests for {@link CustomTransformerRegistry}. */
class CustomTransformerRegistryTest {

  @Test
  @DisplayName("built-in transformers are registered by name")
  void builtins() {
    assertEquals(
        List.of(
            "photometric_data_transformer",
            "statistical_summary",
            "life_table_transformer",
            "beam_table_transformer",
            "eei_table_transformer",
            "zone_table_transformer"),
        CustomTransformerRegistry.withBuiltins().list());
  }

  @Test
  @DisplayName("the transformer receives a copy of the grid, the params and the context")
  void delegatesWithCopy() {
    CustomTransformer transformer = mock(CustomTransformer.class);
    List<List<Object>> output = new ArrayList<>();
    output.add(new ArrayList<>(List.of("out")));
    when(transformer.transform(any(), any(), any())).thenReturn(output);

    CustomTransformerRegistry registry = new CustomTransformerRegistry().register("t", transformer);
    List<List<Object>> input = new ArrayList<>();
    input.add(new ArrayList<>(List.of("in")));
    JsonNode params = JacksonUtility.readTree("{\"k\": 1}");
    TransformContext context = TransformContext.empty();

    List<List<Object>> result = registry.transform("t", input, params, context);

    assertEquals(List.of(List.of("out")), result);
    assertNotSame(output, result);
    verify(transformer).transform(eq(List.of(List.of("in"))), eq(params), eq(context));
  }

  @Test
  @DisplayName("a null context is replaced with an empty one")
  void nullContext() {
    CustomTransformer transformer = mock(CustomTransformer.class);
    when(transformer.transform(any(), any(), any())).thenReturn(new ArrayList<>());
    new CustomTransformerRegistry()
        .register("t", transformer)
        .transform("t", new ArrayList<>(), JacksonUtility.readTree("{}"), null);
    verify(transformer).transform(any(), any(), eq(TransformContext.empty()));
  }

  @Test
  @DisplayName("unknown names are configuration errors")
  void unknownName() {
    CustomTransformerRegistry registry = new CustomTransformerRegistry();
    TransformConfigException e =
        assertThrows(
            TransformConfigException.class,
            () -> registry.transform("nope", new ArrayList<>(), null, null));
    assertEquals("Unknown transformer: nope", e.getMessage());
    assertTrue(registry.get("nope").isEmpty());
  }
}
