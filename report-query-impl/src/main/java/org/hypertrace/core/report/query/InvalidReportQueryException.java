package org.hypertrace.core.report.query;

/** The query assembled for a report is not a SELECT statement. */
public class InvalidReportQueryException extends RuntimeException {
  public InvalidReportQueryException(String message) {
    super(message);
  }
}
