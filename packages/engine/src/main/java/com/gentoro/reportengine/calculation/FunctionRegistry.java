package com.gentoro.reportengine.calculation;

import com.gentoro.reportengine.exception.ExceptionUtil;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Registry of named calculation functions consulted by {@link FieldCalculator}.
 *
 * <p>The typical lifecycle is:
 *
 * <ol>
 *   <li>Create a registry, usually with {@link #withBuiltins()}.
 *   <li>Register additional domain specific functions.
 *   <li>Pass the registry to a {@link FieldCalculator}.
 * </ol>
 *
 * <p>Registering an existing name replaces the previous function. Instances are not thread-safe;
 * populate them before sharing.
 */
public class FunctionRegistry {

  /** Backing map of function name to implementation, in registration order. */
  private final Map<String, CalculationFunction> functions = new LinkedHashMap<>();

  /** A registry pre-populated with {@link BuiltinFunctions}. */
  public static FunctionRegistry withBuiltins() {
    FunctionRegistry registry = new FunctionRegistry();
    BuiltinFunctions.registerAll(registry);
    return registry;
  }

  /**
   * Register a function.
   *
   * @param name name referenced by the {@code function} attribute of field mappings
   * @param function implementation
   * @return this registry for fluent usage
   */
  public FunctionRegistry register(String name, CalculationFunction function) {
    if (name == null || name.isBlank()) {
      throw new IllegalArgumentException("Function name must not be blank");
    }
    functions.put(name, Objects.requireNonNull(function, "function"));
    return this;
  }

  public Optional<CalculationFunction> get(String name) {
    return Optional.ofNullable(name == null ? null : functions.get(name));
  }

  public boolean contains(String name) {
    return name != null && functions.containsKey(name);
  }

  /** Registered names in registration order. */
  public List<String> list() {
    return new ArrayList<>(functions.keySet());
  }

  /**
   * Invoke a registered function.
   *
   * @throws FunctionNotFoundException if {@code name} is not registered
   * @throws CalculatorException if the function throws
   */
  public Object invoke(String name, List<Object> args) {
    CalculationFunction function =
        get(name).orElseThrow(() -> new FunctionNotFoundException(name));
    try {
      return function.apply(args);
    } catch (Exception e) {
      CalculatorException failure =
          new CalculatorException(
              "Error executing function '%s' with args %s: %s"
                  .formatted(name, args, ExceptionUtil.rootMessage(e)),
              e);
      failure.withContext("function", name);
      throw failure;
    }
  }
}
