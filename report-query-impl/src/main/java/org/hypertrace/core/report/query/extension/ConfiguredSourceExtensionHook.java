package org.hypertrace.core.report.query.extension;

import io.reactivex.rxjava3.core.Single;
import java.util.Map;
import javax.inject.Inject;
import lombok.extern.slf4j.Slf4j;
import org.hypertrace.core.report.query.ReportQueryConfig;
import org.hypertrace.core.report.query.api.CompileOptions;
import org.hypertrace.core.report.query.api.ReportSpec;
import org.hypertrace.core.report.query.extension.SourceDefinition.JoinDefinition;
import org.hypertrace.core.report.query.sql.ReportQueryBuilder;

/**
 * Seeds the base table and joins of the report sources declared in configuration. It runs before
 * the hooks of other modules so they can join onto the configured base.
 */
@Slf4j
class ConfiguredSourceExtensionHook implements ExtensionHook {

  private final Map<String, SourceDefinition> sourceDefinitions;

  @Inject
  ConfiguredSourceExtensionHook(ReportQueryConfig config) {
    this.sourceDefinitions = config.getSourceDefinitions();
  }

  @Override
  public boolean supports(String source) {
    return source != null && sourceDefinitions.containsKey(source);
  }

  @Override
  public int getPriority() {
    return 0;
  }

  @Override
  public Single<ExtensionContribution> seed(
      ReportSpec reportSpec,
      CompileOptions compileOptions,
      ReportQueryBuilder queryBuilder,
      ChannelRegistry channelRegistry) {
    SourceDefinition source = sourceDefinitions.get(reportSpec.getSource());
    log.debug("Seeding report query of source {} from table {}", source.getName(), source.getTable());

    queryBuilder.from(source.getTable(), source.getAlias());
    for (JoinDefinition join : source.getJoins()) {
      switch (join.getType()) {
        case INNER:
          queryBuilder.innerJoin(
              join.getFromAlias(), join.getTable(), join.getAlias(), join.getCondition());
          break;
        case LEFT:
        default:
          queryBuilder.leftJoin(
              join.getFromAlias(), join.getTable(), join.getAlias(), join.getCondition());
      }
    }

    return Single.just(
        ExtensionContribution.builder()
            .queryBuilder(queryBuilder)
            .contentTemplate(source.getContentTemplate().orElse(null))
            .build());
  }
}
