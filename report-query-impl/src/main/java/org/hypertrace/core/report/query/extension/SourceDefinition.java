package org.hypertrace.core.report.query.extension;

import com.typesafe.config.Config;
import java.util.List;
import java.util.Optional;
import java.util.stream.Collectors;
import lombok.Value;

/** Configuration of a report source: its base table, joins and content template. */
@Value
public class SourceDefinition {
  private static final String TABLE_CONFIG_KEY = "table";
  private static final String ALIAS_CONFIG_KEY = "alias";
  private static final String CONTENT_TEMPLATE_CONFIG_KEY = "contentTemplate";
  private static final String JOINS_CONFIG_KEY = "joins";

  String name;
  String table;
  String alias;
  Optional<String> contentTemplate;
  List<JoinDefinition> joins;

  public static SourceDefinition parse(String name, Config config) {
    String alias = config.getString(ALIAS_CONFIG_KEY);
    return new SourceDefinition(
        name,
        config.getString(TABLE_CONFIG_KEY),
        alias,
        config.hasPath(CONTENT_TEMPLATE_CONFIG_KEY)
            ? Optional.of(config.getString(CONTENT_TEMPLATE_CONFIG_KEY))
            : Optional.empty(),
        config.hasPath(JOINS_CONFIG_KEY)
            ? config.getConfigList(JOINS_CONFIG_KEY).stream()
                .map(joinConfig -> JoinDefinition.parse(joinConfig, alias))
                .collect(Collectors.toUnmodifiableList())
            : List.of());
  }

  @Value
  public static class JoinDefinition {
    private static final String TYPE_CONFIG_KEY = "type";
    private static final String FROM_ALIAS_CONFIG_KEY = "fromAlias";
    private static final String TABLE_CONFIG_KEY = "table";
    private static final String ALIAS_CONFIG_KEY = "alias";
    private static final String CONDITION_CONFIG_KEY = "on";

    JoinType type;
    String fromAlias;
    String table;
    String alias;
    String condition;

    private static JoinDefinition parse(Config config, String baseAlias) {
      return new JoinDefinition(
          config.hasPath(TYPE_CONFIG_KEY)
              ? config.getEnum(JoinType.class, TYPE_CONFIG_KEY)
              : JoinType.LEFT,
          config.hasPath(FROM_ALIAS_CONFIG_KEY)
              ? config.getString(FROM_ALIAS_CONFIG_KEY)
              : baseAlias,
          config.getString(TABLE_CONFIG_KEY),
          config.getString(ALIAS_CONFIG_KEY),
          config.getString(CONDITION_CONFIG_KEY));
    }
  }

  public enum JoinType {
    INNER,
    LEFT
  }
}
