package org.hypertrace.core.report.query.api;

import java.util.List;
import lombok.Builder;
import lombok.Singular;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

/**
 * Declarative description of a report: which source it reports on, the columns it selects and
 * how those rows are filtered, grouped, aggregated and ordered.
 */
@Value
@Jacksonized
@Builder(toBuilder = true)
public class ReportSpec {
  String source;
  @Singular List<String> columns;
  @Singular List<FilterInstance> filters;

  @Singular("groupByColumn")
  List<String> groupBy;

  @Singular("orderEntry")
  List<OrderSpec> tableOrder;

  @Singular List<Aggregator> aggregators;

  public boolean hasGroupBy() {
    return !groupBy.isEmpty();
  }
}
