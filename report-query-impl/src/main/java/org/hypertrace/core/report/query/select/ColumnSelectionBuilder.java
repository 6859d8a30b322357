package org.hypertrace.core.report.query.select;

import com.google.common.base.Strings;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import org.hypertrace.core.report.query.api.ChannelColumn;
import org.hypertrace.core.report.query.api.ColumnDefinition;
import org.hypertrace.core.report.query.sql.SqlIdentifiers;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/** Builds the SELECT expressions for the columns a report requests. */
public class ColumnSelectionBuilder {

  private static final Logger LOG = LoggerFactory.getLogger(ColumnSelectionBuilder.class);

  /**
   * @param requestedColumns column keys in the order the report lists them
   * @param columnDefinitions registered columns; requested columns missing here are left out
   * @param activeGroupBy the GROUP BY expressions already applied to the query
   */
  public List<String> build(
      List<String> requestedColumns,
      Map<String, ColumnDefinition> columnDefinitions,
      List<String> activeGroupBy) {
    List<String> selectColumns = new ArrayList<>(requestedColumns.size());
    for (String column : requestedColumns) {
      ColumnDefinition definition = columnDefinitions.get(column);
      if (definition == null) {
        LOG.debug("Column {} is not registered for this report, leaving it out", column);
        continue;
      }
      selectColumns.add(buildSelectText(column, definition, activeGroupBy));
    }
    return selectColumns;
  }

  private String buildSelectText(
      String column, ColumnDefinition definition, List<String> activeGroupBy) {
    String selectText;
    if (definition.hasChannelData()) {
      selectText = buildCaseSelect(definition.getChannelData());
    } else if (!Strings.isNullOrEmpty(definition.getGroupByFormula())
        && activeGroupBy.contains(definition.getGroupByFormula())) {
      selectText = definition.getGroupByFormula();
    } else if (!Strings.isNullOrEmpty(definition.getFormula())) {
      selectText = definition.getFormula();
    } else {
      selectText = SqlIdentifiers.sanitizeColumnName(column);
    }

    String prefix = Strings.nullToEmpty(definition.getPrefix());
    String suffix = Strings.nullToEmpty(definition.getSuffix());
    if (!prefix.isEmpty() || !suffix.isEmpty()) {
      selectText =
          String.format("CONCAT(%s, %s, %s)", quote(prefix), selectText, quote(suffix));
    }

    if (!Strings.isNullOrEmpty(definition.getAlias())) {
      selectText += " AS " + definition.getAlias();
    }
    return selectText;
  }

  /** Picks the value of whichever channel's column is set, in channel registration order. */
  private String buildCaseSelect(Map<String, ChannelColumn> channelData) {
    StringBuilder builder = new StringBuilder("CASE");
    for (ChannelColumn channelColumn : channelData.values()) {
      builder
          .append(" WHEN ")
          .append(channelColumn.getColumn())
          .append(" IS NOT NULL THEN ")
          .append(channelColumn.getColumn());
    }
    return builder.append(" ELSE NULL END").toString();
  }

  private String quote(String value) {
    return "'" + value.replace("'", "''") + "'";
  }
}
