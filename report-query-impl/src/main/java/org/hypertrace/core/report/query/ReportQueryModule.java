package org.hypertrace.core.report.query;

import com.google.inject.AbstractModule;
import com.typesafe.config.Config;
import org.hypertrace.core.report.query.extension.ChannelRegistry;
import org.hypertrace.core.report.query.extension.ExtensionModule;
import org.hypertrace.core.report.query.operator.OperatorVocabulary;
import org.hypertrace.core.report.query.validation.ReportValidationModule;

public class ReportQueryModule extends AbstractModule {

  private final ReportQueryConfig config;

  public ReportQueryModule(Config config) {
    this.config = new ReportQueryConfig(config);
  }

  @Override
  protected void configure() {
    bind(ReportQueryConfig.class).toInstance(this.config);
    bind(OperatorVocabulary.class).toInstance(this.config.getOperatorVocabulary());
    bind(ChannelRegistry.class).toInstance(this.config.getChannelRegistry());
    install(new ExtensionModule());
    install(new ReportValidationModule());
  }
}
