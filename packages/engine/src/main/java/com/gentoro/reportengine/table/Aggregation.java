package com.gentoro.reportengine.table;

import java.util.List;
import java.util.Optional;

/** Column aggregations written into the aggregate row of a table. */
public enum Aggregation {
  AVERAGE("average"),
  SUM("sum"),
  MAX("max"),
  MIN("min");

  private final String operation;

  Aggregation(String operation) {
    this.operation = operation;
  }

  public String operation() {
    return operation;
  }

  public static Optional<Aggregation> fromOperation(String operation) {
    for (Aggregation aggregation : values()) {
      if (aggregation.operation.equals(operation)) {
        return Optional.of(aggregation);
      }
    }
    return Optional.empty();
  }

  /** Aggregate a non-empty list of values. */
  public double apply(List<Double> values) {
    if (values.isEmpty()) {
      throw new IllegalArgumentException("Cannot aggregate an empty column");
    }
    double acc = values.get(0);
    for (int i = 1; i < values.size(); i++) {
      double v = values.get(i);
      switch (this) {
        case MAX -> acc = Math.max(acc, v);
        case MIN -> acc = Math.min(acc, v);
        default -> acc += v;
      }
    }
    return this == AVERAGE ? acc / values.size() : acc;
  }
}
