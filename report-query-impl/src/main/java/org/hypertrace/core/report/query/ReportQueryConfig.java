package org.hypertrace.core.report.query;

import com.google.common.collect.ImmutableMap;
import com.typesafe.config.Config;
import com.typesafe.config.ConfigUtil;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import lombok.Value;
import lombok.experimental.NonFinal;
import org.hypertrace.core.report.query.extension.ChannelRegistry;
import org.hypertrace.core.report.query.extension.SourceDefinition;
import org.hypertrace.core.report.query.operator.OperatorVocabulary;

@Value
@NonFinal
public class ReportQueryConfig {

  private static final String CONFIG_PATH_OPERATORS = "operators";
  private static final String CONFIG_PATH_CHANNELS = "channels";
  private static final String CONFIG_PATH_SOURCES = "sources";

  OperatorVocabulary operatorVocabulary;
  ChannelRegistry channelRegistry;
  Map<String, SourceDefinition> sourceDefinitions;

  public ReportQueryConfig(Config config) {
    Config resolved = config.resolve();
    this.operatorVocabulary =
        OperatorVocabulary.parse(resolved.getConfig(CONFIG_PATH_OPERATORS));
    this.channelRegistry =
        ChannelRegistry.parse(
            resolved.hasPath(CONFIG_PATH_CHANNELS)
                ? resolved.getConfigList(CONFIG_PATH_CHANNELS)
                : List.of());
    this.sourceDefinitions = parseSourceDefinitions(resolved);
  }

  private static Map<String, SourceDefinition> parseSourceDefinitions(Config config) {
    if (!config.hasPath(CONFIG_PATH_SOURCES)) {
      return ImmutableMap.of();
    }
    Map<String, SourceDefinition> sourceDefinitions = new LinkedHashMap<>();
    Config sourcesConfig = config.getConfig(CONFIG_PATH_SOURCES);
    for (String name : config.getObject(CONFIG_PATH_SOURCES).keySet()) {
      sourceDefinitions.put(
          name, SourceDefinition.parse(name, sourcesConfig.getConfig(ConfigUtil.quoteString(name))));
    }
    return ImmutableMap.copyOf(sourceDefinitions);
  }
}
