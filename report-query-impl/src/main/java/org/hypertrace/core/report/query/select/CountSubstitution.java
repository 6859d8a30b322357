package org.hypertrace.core.report.query.select;

import java.util.List;
import java.util.stream.Collectors;
import org.hypertrace.core.report.query.sql.ReportQueryBuilder;

/**
 * Replaces the {@value #COUNT_PLACEHOLDER} token in select expressions with a subquery counting
 * the rows the report matches. The subquery is a copy of the query before any SELECT column was
 * added, so it carries the same joins, WHERE and grouping.
 */
public class CountSubstitution {

  public static final String COUNT_PLACEHOLDER = "{{count}}";

  public List<String> rewrite(List<String> selectColumns, ReportQueryBuilder preSelectQuery) {
    if (selectColumns.stream().noneMatch(column -> column.contains(COUNT_PLACEHOLDER))) {
      return selectColumns;
    }
    String countSql = "(" + buildCountQuery(preSelectQuery).getSql() + ")";
    return selectColumns.stream()
        .map(column -> column.replace(COUNT_PLACEHOLDER, countSql))
        .collect(Collectors.toUnmodifiableList());
  }

  ReportQueryBuilder buildCountQuery(ReportQueryBuilder preSelectQuery) {
    return preSelectQuery.copy().select("COUNT(*) as count");
  }
}
