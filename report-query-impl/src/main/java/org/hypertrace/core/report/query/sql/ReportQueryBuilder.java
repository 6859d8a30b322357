package org.hypertrace.core.report.query.sql;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.stream.Collectors;
import javax.annotation.Nullable;
import org.hypertrace.core.report.query.api.SortOrder;

/**
 * Mutable, MySQL-flavoured SQL query builder with named parameters. Extension hooks seed it with
 * the base table and joins; the compiler then adds the report specific clauses.
 */
public class ReportQueryBuilder {

  private static final ExpressionBuilder EXPRESSION_BUILDER = new ExpressionBuilder();

  private QueryType type;
  private final List<String> select;
  private final List<FromPart> from;
  private final Map<String, List<JoinPart>> joins;
  private final List<String> set;
  private CompositeExpression where;
  private final List<String> groupBy;
  private CompositeExpression having;
  private final List<String> orderBy;
  private int firstResult;
  private Integer maxResults;
  private final Params.Builder paramsBuilder;

  public ReportQueryBuilder() {
    this.type = QueryType.SELECT;
    this.select = new ArrayList<>();
    this.from = new ArrayList<>();
    this.joins = new LinkedHashMap<>();
    this.set = new ArrayList<>();
    this.groupBy = new ArrayList<>();
    this.orderBy = new ArrayList<>();
    this.paramsBuilder = Params.newBuilder();
  }

  private ReportQueryBuilder(ReportQueryBuilder other) {
    this.type = other.type;
    this.select = new ArrayList<>(other.select);
    this.from = new ArrayList<>(other.from);
    this.joins = new LinkedHashMap<>();
    other.joins.forEach((alias, parts) -> this.joins.put(alias, new ArrayList<>(parts)));
    this.set = new ArrayList<>(other.set);
    this.where = other.where == null ? null : other.where.copy();
    this.groupBy = new ArrayList<>(other.groupBy);
    this.having = other.having == null ? null : other.having.copy();
    this.orderBy = new ArrayList<>(other.orderBy);
    this.firstResult = other.firstResult;
    this.maxResults = other.maxResults;
    this.paramsBuilder = other.paramsBuilder.copy();
  }

  /** Returns an independent copy; changes to either builder do not affect the other. */
  public ReportQueryBuilder copy() {
    return new ReportQueryBuilder(this);
  }

  public ExpressionBuilder expr() {
    return EXPRESSION_BUILDER;
  }

  public QueryType getType() {
    return type;
  }

  public ReportQueryBuilder select(String... columns) {
    select.clear();
    return addSelect(Arrays.asList(columns));
  }

  public ReportQueryBuilder addSelect(String... columns) {
    return addSelect(Arrays.asList(columns));
  }

  public ReportQueryBuilder addSelect(List<String> columns) {
    select.addAll(columns);
    return this;
  }

  public List<String> getSelect() {
    return List.copyOf(select);
  }

  public ReportQueryBuilder from(String table, @Nullable String alias) {
    from.add(new FromPart(table, alias));
    return this;
  }

  public ReportQueryBuilder update(String table, @Nullable String alias) {
    this.type = QueryType.UPDATE;
    from.clear();
    from.add(new FromPart(table, alias));
    return this;
  }

  public ReportQueryBuilder set(String column, String value) {
    set.add(EXPRESSION_BUILDER.eq(column, value));
    return this;
  }

  public ReportQueryBuilder delete(String table, @Nullable String alias) {
    this.type = QueryType.DELETE;
    from.clear();
    from.add(new FromPart(table, alias));
    return this;
  }

  public ReportQueryBuilder join(String fromAlias, String table, String alias, String condition) {
    return innerJoin(fromAlias, table, alias, condition);
  }

  public ReportQueryBuilder innerJoin(
      String fromAlias, String table, String alias, String condition) {
    return addJoin(fromAlias, new JoinPart("INNER", table, alias, condition));
  }

  public ReportQueryBuilder leftJoin(
      String fromAlias, String table, String alias, String condition) {
    return addJoin(fromAlias, new JoinPart("LEFT", table, alias, condition));
  }

  private ReportQueryBuilder addJoin(String fromAlias, JoinPart joinPart) {
    joins.computeIfAbsent(fromAlias, key -> new ArrayList<>()).add(joinPart);
    return this;
  }

  public ReportQueryBuilder where(CompositeExpression predicate) {
    this.where = EXPRESSION_BUILDER.andX(predicate);
    return this;
  }

  public ReportQueryBuilder andWhere(String predicate) {
    if (where == null) {
      where = EXPRESSION_BUILDER.andX();
    }
    where.add(predicate);
    return this;
  }

  public ReportQueryBuilder andWhere(CompositeExpression predicate) {
    if (where == null) {
      where = EXPRESSION_BUILDER.andX();
    }
    where.add(predicate);
    return this;
  }

  @Nullable
  public CompositeExpression getWhere() {
    return where;
  }

  public ReportQueryBuilder addGroupBy(List<String> expressions) {
    groupBy.addAll(expressions);
    return this;
  }

  public List<String> getGroupBy() {
    return List.copyOf(groupBy);
  }

  public ReportQueryBuilder andHaving(String predicate) {
    if (having == null) {
      having = EXPRESSION_BUILDER.andX();
    }
    having.add(predicate);
    return this;
  }

  public ReportQueryBuilder addOrderBy(String sort, @Nullable SortOrder order) {
    orderBy.add(order == null ? sort : sort + " " + order.name());
    return this;
  }

  public List<String> getOrderBy() {
    return List.copyOf(orderBy);
  }

  public ReportQueryBuilder setFirstResult(int firstResult) {
    this.firstResult = firstResult;
    return this;
  }

  public int getFirstResult() {
    return firstResult;
  }

  public ReportQueryBuilder setMaxResults(int maxResults) {
    this.maxResults = maxResults;
    return this;
  }

  @Nullable
  public Integer getMaxResults() {
    return maxResults;
  }

  public ReportQueryBuilder setLongParameter(String name, long value) {
    paramsBuilder.addLongParam(name, value);
    return this;
  }

  public ReportQueryBuilder setDoubleParameter(String name, double value) {
    paramsBuilder.addDoubleParam(name, value);
    return this;
  }

  public ReportQueryBuilder setStringParameter(String name, String value) {
    paramsBuilder.addStringParam(name, value);
    return this;
  }

  public ReportQueryBuilder setBooleanParameter(String name, boolean value) {
    paramsBuilder.addBooleanParam(name, value);
    return this;
  }

  public Params getParams() {
    return paramsBuilder.build();
  }

  public String getSql() {
    switch (type) {
      case UPDATE:
        return buildUpdateSql();
      case DELETE:
        return buildDeleteSql();
      case SELECT:
      default:
        return buildSelectSql();
    }
  }

  private String buildSelectSql() {
    StringBuilder sqlBuilder = new StringBuilder("SELECT ");
    sqlBuilder.append(String.join(", ", select));

    if (!from.isEmpty()) {
      sqlBuilder.append(" FROM ");
      sqlBuilder.append(from.stream().map(this::renderFromPart).collect(Collectors.joining(", ")));
    }
    appendWhere(sqlBuilder);

    if (!groupBy.isEmpty()) {
      sqlBuilder.append(" GROUP BY ").append(String.join(", ", groupBy));
    }
    if (having != null && having.count() > 0) {
      sqlBuilder.append(" HAVING ").append(having);
    }
    if (!orderBy.isEmpty()) {
      sqlBuilder.append(" ORDER BY ").append(String.join(", ", orderBy));
    }
    if (maxResults != null) {
      sqlBuilder.append(" LIMIT ").append(maxResults);
      if (firstResult > 0) {
        sqlBuilder.append(" OFFSET ").append(firstResult);
      }
    }
    return sqlBuilder.toString();
  }

  private String buildUpdateSql() {
    StringBuilder sqlBuilder = new StringBuilder("UPDATE ");
    sqlBuilder.append(renderTable(from.get(0)));
    sqlBuilder.append(" SET ").append(String.join(", ", set));
    appendWhere(sqlBuilder);
    return sqlBuilder.toString();
  }

  private String buildDeleteSql() {
    StringBuilder sqlBuilder = new StringBuilder("DELETE FROM ");
    sqlBuilder.append(renderTable(from.get(0)));
    appendWhere(sqlBuilder);
    return sqlBuilder.toString();
  }

  private void appendWhere(StringBuilder sqlBuilder) {
    if (where != null && where.count() > 0) {
      sqlBuilder.append(" WHERE ").append(where);
    }
  }

  private String renderFromPart(FromPart fromPart) {
    StringBuilder builder = new StringBuilder(renderTable(fromPart));
    if (fromPart.alias != null) {
      appendJoins(fromPart.alias, builder, new HashSet<>());
    }
    return builder.toString();
  }

  private void appendJoins(String fromAlias, StringBuilder builder, Set<String> visitedAliases) {
    if (!visitedAliases.add(fromAlias)) {
      throw new IllegalStateException("Join alias used more than once: " + fromAlias);
    }
    for (JoinPart joinPart : joins.getOrDefault(fromAlias, List.of())) {
      builder
          .append(" ")
          .append(joinPart.joinType)
          .append(" JOIN ")
          .append(joinPart.table)
          .append(" ")
          .append(joinPart.alias)
          .append(" ON ")
          .append(joinPart.condition);
      appendJoins(joinPart.alias, builder, visitedAliases);
    }
  }

  private String renderTable(FromPart fromPart) {
    return fromPart.alias == null ? fromPart.table : fromPart.table + " " + fromPart.alias;
  }

  private static class FromPart {
    private final String table;
    private final String alias;

    private FromPart(String table, String alias) {
      this.table = table;
      this.alias = alias;
    }
  }

  private static class JoinPart {
    private final String joinType;
    private final String table;
    private final String alias;
    private final String condition;

    private JoinPart(String joinType, String table, String alias, String condition) {
      this.joinType = joinType;
      this.table = table;
      this.alias = alias;
      this.condition = condition;
    }
  }
}
