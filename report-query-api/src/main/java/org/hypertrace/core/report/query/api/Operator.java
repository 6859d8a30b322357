package org.hypertrace.core.report.query.api;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import java.util.Arrays;

/** Filter operators that can be applied to a report column. */
public enum Operator {
  EQ("eq"),
  NEQ("neq"),
  GT("gt"),
  GTE("gte"),
  LT("lt"),
  LTE("lte"),
  LIKE("like"),
  NOT_LIKE("notLike"),
  EMPTY("empty"),
  NOT_EMPTY("notEmpty"),
  CONTAINS("contains"),
  STARTS_WITH("startsWith"),
  ENDS_WITH("endsWith"),
  IN("in"),
  NOT_IN("notIn");

  private final String key;

  Operator(String key) {
    this.key = key;
  }

  @JsonValue
  public String getKey() {
    return key;
  }

  /** Operators that take a list of values rather than a single one. */
  public boolean isMultiValued() {
    return this == IN || this == NOT_IN;
  }

  /** Operators that are rewritten to {@link #LIKE} with wildcards around the value. */
  public boolean isSubstringMatch() {
    return this == CONTAINS || this == STARTS_WITH || this == ENDS_WITH;
  }

  /**
   * Wraps the value with the wildcards this operator implies. Operators that are not substring
   * matches return the value untouched.
   */
  public String toLikePattern(String value) {
    switch (this) {
      case STARTS_WITH:
        return value + "%";
      case ENDS_WITH:
        return "%" + value;
      case CONTAINS:
      case LIKE:
      case NOT_LIKE:
        return "%" + value + "%";
      default:
        return value;
    }
  }

  @JsonCreator
  public static Operator fromKey(String key) {
    return Arrays.stream(values())
        .filter(operator -> operator.key.equals(key))
        .findFirst()
        .orElseThrow(() -> new IllegalArgumentException("Unknown filter operator: " + key));
  }
}
