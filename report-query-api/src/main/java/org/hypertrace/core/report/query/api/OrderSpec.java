package org.hypertrace.core.report.query.api;

import javax.annotation.Nullable;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

/** A column to order by. A missing direction leaves the database default in place. */
@Value
@Jacksonized
@Builder
public class OrderSpec {
  String column;
  @Nullable SortOrder direction;

  public static OrderSpec of(String column, @Nullable SortOrder direction) {
    return OrderSpec.builder().column(column).direction(direction).build();
  }
}
