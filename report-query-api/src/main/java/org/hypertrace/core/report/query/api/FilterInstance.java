package org.hypertrace.core.report.query.api;

import com.fasterxml.jackson.annotation.JsonSetter;
import com.fasterxml.jackson.annotation.Nulls;
import java.util.List;
import javax.annotation.Nullable;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

/** One predicate applied to a report. */
@Value
@Jacksonized
@Builder(toBuilder = true)
public class FilterInstance {
  String column;
  Operator condition;

  /** Overrides {@link #condition} when set. */
  @Nullable Operator expr;

  @Nullable String value;

  /** Values of {@link Operator#IN} and {@link Operator#NOT_IN} filters. */
  @JsonSetter(nulls = Nulls.AS_EMPTY)
  @Builder.Default
  List<String> values = List.of();

  /** Relation to the previous filter instance. */
  @Builder.Default Glue glue = Glue.AND;

  boolean dynamic;

  public Operator getEffectiveOperator() {
    return expr != null ? expr : condition;
  }
}
