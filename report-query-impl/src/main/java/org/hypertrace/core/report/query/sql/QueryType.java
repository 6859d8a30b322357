package org.hypertrace.core.report.query.sql;

public enum QueryType {
  SELECT,
  UPDATE,
  DELETE
}
