package org.hypertrace.core.report.query.validation;

import io.reactivex.rxjava3.core.Completable;
import javax.inject.Inject;
import org.hypertrace.core.report.query.api.CompileOptions;
import org.hypertrace.core.report.query.api.FilterDefinition;
import org.hypertrace.core.report.query.api.FilterInstance;
import org.hypertrace.core.report.query.api.Operator;
import org.hypertrace.core.report.query.api.ReportSpec;
import org.hypertrace.core.report.query.filter.IllegalFilterOperatorException;
import org.hypertrace.core.report.query.filter.MissingFilterDefinitionException;
import org.hypertrace.core.report.query.operator.OperatorVocabulary;

/** Every filter must have a definition and use an operator legal for the definition's type. */
class FilterOperatorValidation implements ReportSpecValidation {

  private final OperatorVocabulary operatorVocabulary;

  @Inject
  FilterOperatorValidation(OperatorVocabulary operatorVocabulary) {
    this.operatorVocabulary = operatorVocabulary;
  }

  @Override
  public Completable validate(ReportSpec reportSpec, CompileOptions compileOptions) {
    for (FilterInstance filter : reportSpec.getFilters()) {
      FilterDefinition definition = compileOptions.getFilters().get(filter.getColumn());
      if (definition == null) {
        return Completable.error(new MissingFilterDefinitionException(filter.getColumn()));
      }
      Operator operator = filter.getEffectiveOperator();
      if (operator == null) {
        return Completable.error(
            new IllegalArgumentException(
                String.format("Filter on column {%s} has no operator", filter.getColumn())));
      }
      if (!operatorVocabulary.isLegal(definition, operator)) {
        return Completable.error(
            new IllegalFilterOperatorException(
                filter.getColumn(), operator, definition.getType()));
      }
    }
    return Completable.complete();
  }
}
