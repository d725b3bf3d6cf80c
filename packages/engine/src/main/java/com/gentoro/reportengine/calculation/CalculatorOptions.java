package com.gentoro.reportengine.calculation;

import com.gentoro.reportengine.config.EngineConfiguration;

/**
 * Error policy of a {@link FieldCalculator}.
 *
 * @param strictMode fail a mapping when one of its argument paths is missing instead of passing
 *     {@code null}
 * @param raiseOnError abort a batch on the first failed mapping instead of logging and continuing
 */
public record CalculatorOptions(boolean strictMode, boolean raiseOnError) {

  public static CalculatorOptions defaults() {
    return new CalculatorOptions(false, false);
  }

  public static CalculatorOptions fromConfiguration(EngineConfiguration configuration) {
    return new CalculatorOptions(configuration.strictMode(), configuration.raiseOnError());
  }
}
