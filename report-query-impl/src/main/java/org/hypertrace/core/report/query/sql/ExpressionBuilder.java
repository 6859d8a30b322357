package org.hypertrace.core.report.query.sql;

import java.util.Arrays;
import java.util.List;

/** Builds SQL predicate fragments. Values passed in are expected to be placeholders or literals. */
public class ExpressionBuilder {

  public static final String EQ = "=";
  public static final String NEQ = "<>";
  public static final String LT = "<";
  public static final String LTE = "<=";
  public static final String GT = ">";
  public static final String GTE = ">=";

  public CompositeExpression andX(String... parts) {
    return new CompositeExpression(CompositeExpression.Type.AND, Arrays.asList(parts));
  }

  public CompositeExpression andX(CompositeExpression part) {
    return andX().add(part);
  }

  public CompositeExpression orX(String... parts) {
    return new CompositeExpression(CompositeExpression.Type.OR, Arrays.asList(parts));
  }

  public String comparison(String x, String operator, String y) {
    return x + " " + operator + " " + y;
  }

  public String eq(String x, String y) {
    return comparison(x, EQ, y);
  }

  public String neq(String x, String y) {
    return comparison(x, NEQ, y);
  }

  public String lt(String x, String y) {
    return comparison(x, LT, y);
  }

  public String lte(String x, String y) {
    return comparison(x, LTE, y);
  }

  public String gt(String x, String y) {
    return comparison(x, GT, y);
  }

  public String gte(String x, String y) {
    return comparison(x, GTE, y);
  }

  public String isNull(String x) {
    return x + " IS NULL";
  }

  public String isNotNull(String x) {
    return x + " IS NOT NULL";
  }

  public String like(String x, String y) {
    return comparison(x, "LIKE", y);
  }

  public String notLike(String x, String y) {
    return comparison(x, "NOT LIKE", y);
  }

  public String in(String x, List<String> y) {
    return comparison(x, "IN", "(" + String.join(", ", y) + ")");
  }

  public String notIn(String x, List<String> y) {
    return comparison(x, "NOT IN", "(" + String.join(", ", y) + ")");
  }

  /** Quotes a constant known at configuration time. Runtime values must be bound instead. */
  public String literal(String value) {
    return "'" + value.replace("'", "''") + "'";
  }
}
