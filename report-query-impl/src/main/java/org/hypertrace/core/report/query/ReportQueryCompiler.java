package org.hypertrace.core.report.query;

import com.google.common.base.Strings;
import com.google.common.collect.ImmutableList;
import io.reactivex.rxjava3.core.Observable;
import io.reactivex.rxjava3.core.Single;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import javax.inject.Inject;
import javax.inject.Singleton;
import lombok.extern.slf4j.Slf4j;
import org.hypertrace.core.report.query.aggregation.GroupingAssembler;
import org.hypertrace.core.report.query.api.CompileOptions;
import org.hypertrace.core.report.query.api.FilterInstance;
import org.hypertrace.core.report.query.api.ReportSpec;
import org.hypertrace.core.report.query.extension.ChannelRegistry;
import org.hypertrace.core.report.query.extension.ExtensionContribution;
import org.hypertrace.core.report.query.extension.ExtensionHook;
import org.hypertrace.core.report.query.filter.FilterExpressionBuilder;
import org.hypertrace.core.report.query.order.OrderingAssembler;
import org.hypertrace.core.report.query.select.ColumnSelectionBuilder;
import org.hypertrace.core.report.query.select.CountSubstitution;
import org.hypertrace.core.report.query.sql.CompositeExpression;
import org.hypertrace.core.report.query.sql.QueryType;
import org.hypertrace.core.report.query.sql.ReportQueryBuilder;
import org.hypertrace.core.report.query.validation.ReportSpecValidator;

/**
 * Compiles a report spec and the options of one request into a single parameterized SELECT
 * statement.
 *
 * <p>The clauses are applied in a fixed order: validation, seeding by the extension hooks of the
 * report's source, dynamic filter values, WHERE, ORDER BY, GROUP BY, LIMIT/OFFSET, HAVING, the
 * SELECT list and finally the aggregate expressions. The count subquery is cut from the query as
 * it stands before the SELECT list is added, so this order is observable in the output.
 */
@Singleton
@Slf4j
public class ReportQueryCompiler {

  private final List<ExtensionHook> hooks;
  private final ReportSpecValidator validator;
  private final ChannelRegistry channelRegistry;

  private final FilterExpressionBuilder filterExpressionBuilder = new FilterExpressionBuilder();
  private final ColumnSelectionBuilder columnSelectionBuilder = new ColumnSelectionBuilder();
  private final CountSubstitution countSubstitution = new CountSubstitution();
  private final GroupingAssembler groupingAssembler = new GroupingAssembler();
  private final OrderingAssembler orderingAssembler = new OrderingAssembler();

  @Inject
  public ReportQueryCompiler(
      Set<ExtensionHook> hooks, ReportSpecValidator validator, ChannelRegistry channelRegistry) {
    this.hooks = ImmutableList.sortedCopyOf(hooks);
    this.validator = validator;
    this.channelRegistry = channelRegistry;
  }

  public ReportQuery compile(ReportSpec reportSpec, CompileOptions compileOptions) {
    validator.validate(reportSpec, compileOptions).blockingAwait();

    ExtensionContribution contribution = seed(reportSpec, compileOptions).blockingGet();
    ReportQueryBuilder queryBuilder = contribution.getQueryBuilder();

    List<FilterInstance> filters =
        DynamicFilterMerger.merge(reportSpec.getFilters(), compileOptions.getDynamicFilters());
    if (!filters.isEmpty()) {
      // a hook expression only stands in for the report's own filters
      Optional<CompositeExpression> hookFilterExpression = contribution.getFilterExpression();
      if (hookFilterExpression.isPresent()) {
        queryBuilder.andWhere(hookFilterExpression.get());
      } else {
        filterExpressionBuilder.apply(filters, compileOptions.getFilters(), queryBuilder);
      }
    }

    orderingAssembler.applyOrder(reportSpec, compileOptions, queryBuilder);
    groupingAssembler.applyGroupBy(reportSpec, compileOptions, queryBuilder);
    orderingAssembler.applyPagination(compileOptions, queryBuilder);
    groupingAssembler.applyHaving(compileOptions, queryBuilder);

    List<String> selectColumns =
        contribution.getSelectColumns().isEmpty()
            ? columnSelectionBuilder.build(
                reportSpec.getColumns(), compileOptions.getColumns(), queryBuilder.getGroupBy())
            : contribution.getSelectColumns();
    queryBuilder.addSelect(countSubstitution.rewrite(selectColumns, queryBuilder));

    groupingAssembler.applyAggregators(reportSpec, compileOptions, queryBuilder);

    if (queryBuilder.getType() != QueryType.SELECT) {
      throw new InvalidReportQueryException("Only SELECT statements are valid");
    }

    ReportQuery reportQuery =
        new ReportQuery(
            queryBuilder.getSql(),
            queryBuilder.getParams(),
            contribution.getContentTemplate().orElse(null));
    if (log.isDebugEnabled()) {
      log.debug("Report source: {}, compiled query: {}", reportSpec.getSource(), reportQuery.getSql());
      log.debug("Resolved statement: {}", reportQuery.resolveStatement());
    }
    return reportQuery;
  }

  /**
   * Runs the hooks supporting the report's source in priority order, each seeding the query
   * builder returned by the previous one.
   */
  private Single<ExtensionContribution> seed(
      ReportSpec reportSpec, CompileOptions compileOptions) {
    String source = Strings.nullToEmpty(reportSpec.getSource());
    List<ExtensionHook> supportingHooks =
        hooks.stream()
            .filter(hook -> hook.supports(source))
            .collect(ImmutableList.toImmutableList());
    if (supportingHooks.isEmpty()) {
      return Single.error(
          new UnsupportedOperationException("No extension hook supports report source: " + source));
    }
    log.debug("Seeding report source {} with {} hooks", source, supportingHooks.size());

    return Observable.fromIterable(supportingHooks)
        .reduce(
            Single.just(ExtensionContribution.of(new ReportQueryBuilder())),
            (contributionSingle, hook) ->
                contributionSingle.flatMap(
                    contribution ->
                        hook.seed(
                                reportSpec,
                                compileOptions,
                                contribution.getQueryBuilder(),
                                channelRegistry)
                            .map(contribution::mergeWith)))
        .flatMap(contribution -> contribution);
  }
}
