package org.hypertrace.core.report.query.filter;

/** A filter instance references a column with no registered filter definition. */
public class MissingFilterDefinitionException extends IllegalArgumentException {

  private final String column;

  public MissingFilterDefinitionException(String column) {
    super(String.format("No filter definition registered for column: {%s}", column));
    this.column = column;
  }

  public String getColumn() {
    return column;
  }
}
