package org.hypertrace.core.report.query.aggregation;

import com.google.common.base.Strings;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import org.hypertrace.core.report.query.api.Aggregator;
import org.hypertrace.core.report.query.api.ColumnDefinition;
import org.hypertrace.core.report.query.api.CompileOptions;
import org.hypertrace.core.report.query.api.ReportSpec;
import org.hypertrace.core.report.query.sql.ReportQueryBuilder;
import org.hypertrace.core.report.query.sql.SqlIdentifiers;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/** Applies GROUP BY, HAVING and the aggregate select expressions of a report. */
public class GroupingAssembler {

  private static final Logger LOG = LoggerFactory.getLogger(GroupingAssembler.class);

  public void applyGroupBy(ReportSpec spec, CompileOptions options, ReportQueryBuilder queryBuilder) {
    if (spec.hasGroupBy()) {
      List<String> groupByColumns = new ArrayList<>(spec.getGroupBy().size());
      for (String groupBy : spec.getGroupBy()) {
        ColumnDefinition definition = options.getColumns().get(groupBy);
        if (definition == null) {
          LOG.debug("Group by column {} is not registered for this report, ignoring it", groupBy);
          continue;
        }
        if (!Strings.isNullOrEmpty(definition.getGroupByFormula())) {
          groupByColumns.add(definition.getGroupByFormula());
        } else if (!Strings.isNullOrEmpty(definition.getFormula())) {
          groupByColumns.add(definition.getFormula());
        } else {
          groupByColumns.add(groupBy);
        }
      }
      queryBuilder.addGroupBy(groupByColumns);
    } else if (!options.getGroupBy().isEmpty()) {
      queryBuilder.addGroupBy(options.getGroupBy());
    }
  }

  public void applyHaving(CompileOptions options, ReportQueryBuilder queryBuilder) {
    options.getHaving().stream()
        .filter(having -> !Strings.isNullOrEmpty(having))
        .forEach(queryBuilder::andHaving);
  }

  /**
   * Adds one {@code FUNCTION(column) AS 'FUNCTION column'} expression per aggregator. Aggregates
   * without a group by declared on the report are not supported and left out.
   */
  public void applyAggregators(
      ReportSpec spec, CompileOptions options, ReportQueryBuilder queryBuilder) {
    if (spec.getAggregators().isEmpty()) {
      return;
    }
    if (!spec.hasGroupBy()) {
      LOG.debug("Ignoring {} aggregators of a report without group by", spec.getAggregators().size());
      return;
    }

    List<String> aggregatorSelect = new ArrayList<>(spec.getAggregators().size());
    for (Aggregator aggregator : spec.getAggregators()) {
      String column = aggregator.getColumn();
      aggregatorSelect.add(
          String.format(
              "%s(%s) AS '%s %s'",
              aggregator.getFunction().name(),
              resolveAggregatedColumn(column, options.getColumns()),
              aggregator.getFunction().name(),
              column.replace("'", "''")));
    }
    queryBuilder.addSelect(aggregatorSelect);
  }

  private String resolveAggregatedColumn(
      String column, Map<String, ColumnDefinition> columnDefinitions) {
    ColumnDefinition definition = columnDefinitions.get(column);
    if (definition == null) {
      return SqlIdentifiers.requirePlainReference(column);
    }
    return Strings.isNullOrEmpty(definition.getFormula()) ? column : definition.getFormula();
  }
}
