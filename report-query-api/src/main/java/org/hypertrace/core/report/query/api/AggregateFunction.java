package org.hypertrace.core.report.query.api;

import com.fasterxml.jackson.annotation.JsonCreator;
import java.util.Locale;

/** Aggregate functions a report may request alongside a group by. */
public enum AggregateFunction {
  COUNT,
  SUM,
  AVG,
  MIN,
  MAX;

  @JsonCreator
  public static AggregateFunction fromString(String value) {
    try {
      return valueOf(value.trim().toUpperCase(Locale.ROOT));
    } catch (IllegalArgumentException | NullPointerException e) {
      throw new IllegalArgumentException("Unsupported aggregate function: " + value, e);
    }
  }
}
