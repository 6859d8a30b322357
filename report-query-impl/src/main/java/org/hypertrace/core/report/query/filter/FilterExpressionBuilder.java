package org.hypertrace.core.report.query.filter;

import com.google.common.base.Strings;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import org.hypertrace.core.report.query.api.FilterDefinition;
import org.hypertrace.core.report.query.api.FilterInstance;
import org.hypertrace.core.report.query.api.Glue;
import org.hypertrace.core.report.query.api.Operator;
import org.hypertrace.core.report.query.sql.CompositeExpression;
import org.hypertrace.core.report.query.sql.ExpressionBuilder;
import org.hypertrace.core.report.query.sql.ReportQueryBuilder;
import org.hypertrace.core.report.query.sql.SqlIdentifiers;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Turns the ordered filter instances of a report into one boolean expression.
 *
 * <p>Filters are collected into AND groups. A filter glued with {@code or} closes the current
 * group, when that group has any predicate, and opens the next one. Several groups are ORed and
 * the result wrapped in an AND so that callers can keep appending conditions.
 */
public class FilterExpressionBuilder {

  private static final Logger LOG = LoggerFactory.getLogger(FilterExpressionBuilder.class);

  /** Builds the filter expression and ANDs it into the WHERE clause of the query. */
  public boolean apply(
      List<FilterInstance> filters,
      Map<String, FilterDefinition> filterDefinitions,
      ReportQueryBuilder queryBuilder) {
    Optional<CompositeExpression> filterExpression =
        build(filters, filterDefinitions, queryBuilder);
    filterExpression.ifPresent(queryBuilder::andWhere);
    return filterExpression.isPresent();
  }

  /**
   * Builds the filter expression, binding filter values on the query. Returns empty when every
   * filter was skipped.
   */
  public Optional<CompositeExpression> build(
      List<FilterInstance> filters,
      Map<String, FilterDefinition> filterDefinitions,
      ReportQueryBuilder queryBuilder) {
    ExpressionBuilder expr = queryBuilder.expr();
    List<CompositeExpression> groups = new ArrayList<>();
    CompositeExpression groupExpr = expr.andX();

    for (int i = 0; i < filters.size(); i++) {
      FilterInstance filter = filters.get(i);
      FilterDefinition definition = filterDefinitions.get(filter.getColumn());
      if (definition == null) {
        throw new MissingFilterDefinitionException(filter.getColumn());
      }

      if (Glue.OR.equals(filter.getGlue()) && groupExpr.count() > 0) {
        groups.add(groupExpr);
        groupExpr = expr.andX();
      }

      String paramName = String.format("i%dc%s", i, SqlIdentifiers.alphanumeric(filter.getColumn()));
      String column =
          Strings.isNullOrEmpty(definition.getFormula())
              ? filter.getColumn()
              : definition.getFormula();
      addPredicate(filter, definition, column, paramName, groupExpr, queryBuilder);
    }

    if (groupExpr.count() > 0) {
      groups.add(groupExpr);
    }

    if (groups.isEmpty()) {
      return Optional.empty();
    }
    if (groups.size() == 1) {
      return Optional.of(groups.get(0));
    }
    return Optional.of(expr.andX(expr.orX().addAll(groups)));
  }

  private void addPredicate(
      FilterInstance filter,
      FilterDefinition definition,
      String column,
      String paramName,
      CompositeExpression groupExpr,
      ReportQueryBuilder queryBuilder) {
    ExpressionBuilder expr = queryBuilder.expr();
    Operator operator = filter.getEffectiveOperator();
    boolean supportsEmptyValue = !definition.getType().isTemporal();

    switch (operator) {
      case NOT_EMPTY:
        groupExpr.add(expr.isNotNull(column));
        if (supportsEmptyValue) {
          groupExpr.add(expr.neq(column, expr.literal("")));
        }
        return;
      case EMPTY:
        CompositeExpression emptyExpr = expr.orX(expr.isNull(column));
        if (supportsEmptyValue) {
          emptyExpr.add(expr.eq(column, expr.literal("")));
        }
        groupExpr.add(emptyExpr);
        return;
      case IN:
      case NOT_IN:
        List<String> placeholders = bindValues(filter, definition, paramName, queryBuilder);
        if (placeholders.isEmpty()) {
          LOG.debug("Skipping {} filter on column {}: no values", operator.getKey(), column);
          return;
        }
        groupExpr.add(
            Operator.IN.equals(operator)
                ? expr.in(column, placeholders)
                : expr.notIn(column, placeholders));
        return;
      default:
        break;
    }

    String value = Strings.nullToEmpty(filter.getValue());
    // neq keeps blank values: NULL or anything other than '' matches
    if (!Operator.NEQ.equals(operator) && value.trim().isEmpty()) {
      LOG.debug("Skipping {} filter on column {}: blank value", operator.getKey(), column);
      return;
    }

    String placeholder = ":" + paramName;
    Operator sqlOperator = operator;
    if (operator.isSubstringMatch()) {
      sqlOperator = Operator.LIKE;
      queryBuilder.setStringParameter(paramName, operator.toLikePattern(value));
    } else {
      switch (definition.getType()) {
        case BOOL:
          if (FilterValueCoercion.toLong(value) > 1) {
            // "2" is the tri-state reset value of boolean filters
            LOG.debug("Skipping boolean filter on column {}: reset value {}", column, value);
            return;
          }
          queryBuilder.setBooleanParameter(paramName, FilterValueCoercion.toBoolean(value));
          break;
        case INT:
          queryBuilder.setLongParameter(paramName, FilterValueCoercion.toLong(value));
          break;
        case FLOAT:
          queryBuilder.setDoubleParameter(paramName, FilterValueCoercion.toDouble(value));
          break;
        default:
          queryBuilder.setStringParameter(paramName, value);
      }
    }

    if (Operator.NEQ.equals(sqlOperator)) {
      // NULL counts as "not equal". notLike and notIn do not get the same treatment.
      groupExpr.add(expr.orX(expr.isNull(column), expr.neq(column, placeholder)));
    } else {
      groupExpr.add(toComparison(sqlOperator, column, placeholder, expr));
    }
  }

  private List<String> bindValues(
      FilterInstance filter,
      FilterDefinition definition,
      String paramName,
      ReportQueryBuilder queryBuilder) {
    List<String> values = new ArrayList<>();
    filter.getValues().stream()
        .filter(value -> !Strings.isNullOrEmpty(value) && !value.trim().isEmpty())
        .forEach(values::add);
    if (values.isEmpty() && !Strings.isNullOrEmpty(filter.getValue())
        && !filter.getValue().trim().isEmpty()) {
      values.add(filter.getValue());
    }

    List<String> placeholders = new ArrayList<>(values.size());
    for (int j = 0; j < values.size(); j++) {
      String name = paramName + "_" + j;
      switch (definition.getType()) {
        case INT:
          queryBuilder.setLongParameter(name, FilterValueCoercion.toLong(values.get(j)));
          break;
        case FLOAT:
          queryBuilder.setDoubleParameter(name, FilterValueCoercion.toDouble(values.get(j)));
          break;
        default:
          queryBuilder.setStringParameter(name, values.get(j));
      }
      placeholders.add(":" + name);
    }
    return placeholders;
  }

  private String toComparison(
      Operator operator, String column, String placeholder, ExpressionBuilder expr) {
    switch (operator) {
      case EQ:
        return expr.eq(column, placeholder);
      case GT:
        return expr.gt(column, placeholder);
      case GTE:
        return expr.gte(column, placeholder);
      case LT:
        return expr.lt(column, placeholder);
      case LTE:
        return expr.lte(column, placeholder);
      case LIKE:
        return expr.like(column, placeholder);
      case NOT_LIKE:
        return expr.notLike(column, placeholder);
      default:
        throw new UnsupportedOperationException("Unsupported filter operator: " + operator);
    }
  }
}
