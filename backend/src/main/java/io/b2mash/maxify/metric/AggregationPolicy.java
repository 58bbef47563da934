package io.b2mash.maxify.metric;

import io.b2mash.maxify.unit.ValueKind;

/** How recording a value against a task combines with values already recorded for a metric. */
public enum AggregationPolicy {
  /** One current value per task; a new value is added to it. */
  SCALAR_ACCUMULATE,
  /** One current value per task; a new value replaces it. */
  SCALAR_OVERWRITE,
  /** Every value is kept as its own histogram entry; the total is their sum. */
  HISTOGRAM_APPEND;

  public static AggregationPolicy defaultFor(ValueKind kind) {
    return switch (kind) {
      case INTEGER, DECIMAL -> SCALAR_ACCUMULATE;
      case DURATION -> HISTOGRAM_APPEND;
      case STRING -> SCALAR_OVERWRITE;
    };
  }

  public boolean isCumulative() {
    return this == HISTOGRAM_APPEND;
  }

  public boolean isSupportedBy(ValueKind kind) {
    return this == SCALAR_OVERWRITE || kind.isNumeric();
  }
}
