package org.hypertrace.core.report.query;

import com.google.common.collect.ImmutableList;
import java.util.List;
import java.util.Map;
import org.hypertrace.core.report.query.api.DynamicFilterOverride;
import org.hypertrace.core.report.query.api.FilterInstance;
import org.hypertrace.core.report.query.api.Operator;

/**
 * Applies request-time values to the dynamic filters of a report. The report's own filter list is
 * never modified; a new list is returned in which overridden filters keep their position and glue.
 */
class DynamicFilterMerger {

  private DynamicFilterMerger() {
    // empty private constructor
  }

  static List<FilterInstance> merge(
      List<FilterInstance> filters, Map<String, DynamicFilterOverride> dynamicFilters) {
    if (dynamicFilters.isEmpty()) {
      return filters;
    }
    return filters.stream()
        .map(
            filter -> {
              DynamicFilterOverride override = dynamicFilters.get(filter.getColumn());
              return filter.isDynamic() && override != null ? applyOverride(filter, override) : filter;
            })
        .collect(ImmutableList.toImmutableList());
  }

  /**
   * Substring filters receive their wildcards here and become plain {@code like} filters, so that
   * the filter builder binds the value exactly as shaped.
   */
  private static FilterInstance applyOverride(
      FilterInstance filter, DynamicFilterOverride override) {
    String value = override.getValue() == null ? "" : override.getValue();
    FilterInstance.FilterInstanceBuilder builder = filter.toBuilder();
    Operator condition = filter.getCondition();
    if (condition == null) {
      return builder.value(value).build();
    }
    if (condition.isMultiValued()) {
      return builder.value(value).values(List.of(value)).build();
    }

    switch (condition) {
      case STARTS_WITH:
      case ENDS_WITH:
      case CONTAINS:
      case LIKE:
        return builder.value(condition.toLikePattern(value)).expr(Operator.LIKE).build();
      case NOT_LIKE:
        return builder.value(condition.toLikePattern(value)).expr(Operator.NOT_LIKE).build();
      default:
        return builder.value(value).build();
    }
  }
}
