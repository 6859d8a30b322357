package org.hypertrace.core.report.query.api;

import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

/** A request-time value for the dynamic filters of a report on {@code column}. */
@Value
@Jacksonized
@Builder
public class DynamicFilterOverride {
  String column;
  String value;
}
