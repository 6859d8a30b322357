package org.hypertrace.core.report.query.api;

import com.fasterxml.jackson.annotation.JsonAlias;
import com.fasterxml.jackson.annotation.JsonFormat;
import com.fasterxml.jackson.annotation.JsonSetter;
import com.fasterxml.jackson.annotation.Nulls;
import com.fasterxml.jackson.databind.annotation.JsonDeserialize;
import java.util.List;
import java.util.Map;
import lombok.Builder;
import lombok.Singular;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

/** Per-request options and the column/filter registries resolved for the report's source. */
@Value
@Jacksonized
@Builder(toBuilder = true)
public class CompileOptions {

  /** Request-time values for dynamic filters, keyed by column. */
  @JsonDeserialize(using = DynamicFilterOverrideMapDeserializer.class)
  @Builder.Default
  Map<String, DynamicFilterOverride> dynamicFilters = Map.of();

  /** Ordering override; empty means the report's own table order applies. */
  @JsonDeserialize(using = OrderSpecListDeserializer.class)
  @Builder.Default
  List<OrderSpec> order = List.of();

  /** Raw group by expressions, used only when the report declares no group by of its own. */
  @JsonAlias("groupby")
  @JsonSetter(nulls = Nulls.AS_EMPTY)
  @Builder.Default
  List<String> groupBy = List.of();

  int limit;
  int start;

  /** Raw HAVING conditions, each ANDed to the others. */
  @JsonFormat(with = JsonFormat.Feature.ACCEPT_SINGLE_VALUE_AS_ARRAY)
  @JsonSetter(nulls = Nulls.AS_EMPTY)
  @Builder.Default
  List<String> having = List.of();

  @Singular Map<String, ColumnDefinition> columns;
  @Singular Map<String, FilterDefinition> filters;
}
