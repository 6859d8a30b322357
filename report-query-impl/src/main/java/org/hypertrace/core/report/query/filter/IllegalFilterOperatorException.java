package org.hypertrace.core.report.query.filter;

import org.hypertrace.core.report.query.api.Operator;
import org.hypertrace.core.report.query.api.SemanticType;

/** A filter applies an operator that is not legal for its column's type. */
public class IllegalFilterOperatorException extends IllegalArgumentException {

  public IllegalFilterOperatorException(String column, Operator operator, SemanticType type) {
    super(
        String.format(
            "Operator {%s} is not allowed on column {%s} of type {%s}",
            operator.getKey(), column, type.getKey()));
  }
}
