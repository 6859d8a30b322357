package org.hypertrace.core.report.query.api;

import com.fasterxml.jackson.annotation.JsonCreator;
import java.util.Locale;

public enum SortOrder {
  ASC,
  DESC;

  public static boolean isSortOrder(String value) {
    return value != null && ("ASC".equalsIgnoreCase(value) || "DESC".equalsIgnoreCase(value));
  }

  @JsonCreator
  public static SortOrder fromString(String value) {
    if (value == null || value.isBlank()) {
      return ASC;
    }
    if (!isSortOrder(value.trim())) {
      throw new IllegalArgumentException("Unknown sort direction: " + value);
    }
    return valueOf(value.trim().toUpperCase(Locale.ROOT));
  }
}
