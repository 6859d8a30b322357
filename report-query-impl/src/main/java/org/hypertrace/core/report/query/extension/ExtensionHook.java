package org.hypertrace.core.report.query.extension;

import io.reactivex.rxjava3.core.Single;
import org.hypertrace.core.report.query.api.CompileOptions;
import org.hypertrace.core.report.query.api.ReportSpec;
import org.hypertrace.core.report.query.sql.ReportQueryBuilder;
import org.jetbrains.annotations.NotNull;

/**
 * Contract for modules contributing to report queries of the sources they own. A hook seeds the
 * base table and joins of the query and may take over the WHERE or SELECT construction.
 *
 * <p>Hooks supporting a source are invoked in priority order, each one receiving the query
 * builder the previous one returned.
 */
public interface ExtensionHook extends Comparable<ExtensionHook> {

  boolean supports(String source);

  Single<ExtensionContribution> seed(
      ReportSpec reportSpec,
      CompileOptions compileOptions,
      ReportQueryBuilder queryBuilder,
      ChannelRegistry channelRegistry);

  default int getPriority() {
    return 10;
  }

  @Override
  default int compareTo(@NotNull ExtensionHook other) {
    return Integer.compare(this.getPriority(), other.getPriority());
  }
}
