package org.hypertrace.core.report.query.api;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import java.util.Locale;

/** How a filter instance joins the one before it. */
public enum Glue {
  AND,
  OR;

  @JsonValue
  public String getKey() {
    return name().toLowerCase(Locale.ROOT);
  }

  @JsonCreator
  public static Glue fromKey(String key) {
    return "or".equalsIgnoreCase(key) ? OR : AND;
  }
}
