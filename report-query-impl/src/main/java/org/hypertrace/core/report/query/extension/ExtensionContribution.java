package org.hypertrace.core.report.query.extension;

import java.util.List;
import java.util.Optional;
import javax.annotation.Nullable;
import lombok.Builder;
import lombok.Singular;
import lombok.Value;
import org.hypertrace.core.report.query.sql.CompositeExpression;
import org.hypertrace.core.report.query.sql.ReportQueryBuilder;

/**
 * What an extension hook hands back: the seeded query, and optionally a filter expression or
 * select list replacing the ones the compiler would build, and the content template used to
 * render the results.
 */
@Value
@Builder(toBuilder = true)
public class ExtensionContribution {
  ReportQueryBuilder queryBuilder;
  @Nullable CompositeExpression filterExpression;
  @Singular List<String> selectColumns;
  @Nullable String contentTemplate;

  public static ExtensionContribution of(ReportQueryBuilder queryBuilder) {
    return ExtensionContribution.builder().queryBuilder(queryBuilder).build();
  }

  public Optional<CompositeExpression> getFilterExpression() {
    return Optional.ofNullable(filterExpression);
  }

  public Optional<String> getContentTemplate() {
    return Optional.ofNullable(contentTemplate);
  }

  /** Anything the later contribution leaves unset is kept from this one. */
  public ExtensionContribution mergeWith(ExtensionContribution later) {
    return ExtensionContribution.builder()
        .queryBuilder(later.getQueryBuilder())
        .filterExpression(later.getFilterExpression().orElse(filterExpression))
        .selectColumns(later.getSelectColumns().isEmpty() ? selectColumns : later.getSelectColumns())
        .contentTemplate(later.getContentTemplate().orElse(contentTemplate))
        .build();
  }
}
