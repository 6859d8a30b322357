package org.hypertrace.core.report.query;

import com.google.common.collect.ImmutableList;
import com.google.inject.Guice;
import com.google.inject.Module;
import com.typesafe.config.Config;
import com.typesafe.config.ConfigFactory;

public class ReportQueryCompilerFactory {
  private static final String CONFIG_PATH_REPORT_QUERY = "report.query";

  /**
   * @param config the {@code report.query} section
   * @param additionalModules modules registering extension hooks of other report sources
   */
  public static ReportQueryCompiler build(Config config, Module... additionalModules) {
    return Guice.createInjector(
            ImmutableList.<Module>builder()
                .add(new ReportQueryModule(config))
                .add(additionalModules)
                .build())
        .getInstance(ReportQueryCompiler.class);
  }

  /** Builds the compiler from the {@code report.query} section of the default config. */
  public static ReportQueryCompiler build(Module... additionalModules) {
    return build(ConfigFactory.load().getConfig(CONFIG_PATH_REPORT_QUERY), additionalModules);
  }
}
