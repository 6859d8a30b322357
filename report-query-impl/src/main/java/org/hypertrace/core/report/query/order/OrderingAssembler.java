package org.hypertrace.core.report.query.order;

import com.google.common.base.Strings;
import java.util.Map;
import org.hypertrace.core.report.query.api.ColumnDefinition;
import org.hypertrace.core.report.query.api.CompileOptions;
import org.hypertrace.core.report.query.api.OrderSpec;
import org.hypertrace.core.report.query.api.ReportSpec;
import org.hypertrace.core.report.query.sql.ReportQueryBuilder;
import org.hypertrace.core.report.query.sql.SqlIdentifiers;

/** Applies ORDER BY and LIMIT/OFFSET. */
public class OrderingAssembler {

  /**
   * Orders by the request's override when there is one, otherwise by the report's own table
   * order. Every order spec is applied, in sequence.
   */
  public void applyOrder(ReportSpec spec, CompileOptions options, ReportQueryBuilder queryBuilder) {
    if (!options.getOrder().isEmpty()) {
      for (OrderSpec orderSpec : options.getOrder()) {
        queryBuilder.addOrderBy(
            resolveOrderColumn(orderSpec.getColumn(), options.getColumns()),
            orderSpec.getDirection());
      }
      return;
    }

    for (OrderSpec orderSpec : spec.getTableOrder()) {
      if (Strings.isNullOrEmpty(orderSpec.getColumn())) {
        continue;
      }
      queryBuilder.addOrderBy(
          resolveOrderColumn(orderSpec.getColumn(), options.getColumns()),
          orderSpec.getDirection());
    }
  }

  public void applyPagination(CompileOptions options, ReportQueryBuilder queryBuilder) {
    if (options.getLimit() > 0) {
      queryBuilder.setFirstResult(Math.max(options.getStart(), 0)).setMaxResults(options.getLimit());
    }
  }

  /** Registered columns order by their formula, anything else must be a plain reference. */
  private String resolveOrderColumn(
      String column, Map<String, ColumnDefinition> columnDefinitions) {
    ColumnDefinition definition = columnDefinitions.get(column);
    if (definition == null) {
      return SqlIdentifiers.requirePlainReference(column);
    }
    return Strings.isNullOrEmpty(definition.getFormula()) ? column : definition.getFormula();
  }
}
