package org.hypertrace.core.report.query.api;

import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

@Value
@Jacksonized
@Builder
public class Aggregator {
  AggregateFunction function;
  String column;
}
