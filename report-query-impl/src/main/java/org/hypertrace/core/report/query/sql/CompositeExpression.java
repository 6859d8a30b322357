package org.hypertrace.core.report.query.sql;

import java.util.ArrayList;
import java.util.List;

/**
 * A boolean expression combining its parts with either AND or OR. Parts are rendered when they
 * are added, so a composite must be complete before it is added to another one.
 */
public class CompositeExpression {

  public enum Type {
    AND,
    OR
  }

  private final Type type;
  private final List<String> parts;

  CompositeExpression(Type type, List<String> parts) {
    this.type = type;
    this.parts = new ArrayList<>(parts);
  }

  public Type getType() {
    return type;
  }

  public CompositeExpression add(String part) {
    if (part != null && !part.isEmpty()) {
      parts.add(part);
    }
    return this;
  }

  /** Empty composites are ignored. */
  public CompositeExpression add(CompositeExpression part) {
    if (part != null && part.count() > 0) {
      parts.add(part.toString());
    }
    return this;
  }

  public CompositeExpression addAll(List<CompositeExpression> expressions) {
    expressions.forEach(this::add);
    return this;
  }

  public int count() {
    return parts.size();
  }

  CompositeExpression copy() {
    return new CompositeExpression(type, parts);
  }

  @Override
  public String toString() {
    if (parts.size() == 1) {
      return parts.get(0);
    }
    return "(" + String.join(") " + type + " (", parts) + ")";
  }
}
