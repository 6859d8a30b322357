package org.hypertrace.core.report.query.operator;

import com.google.common.collect.ImmutableMap;
import com.typesafe.config.Config;
import com.typesafe.config.ConfigException;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;
import org.hypertrace.core.report.query.api.FilterDefinition;
import org.hypertrace.core.report.query.api.Operator;
import org.hypertrace.core.report.query.api.OperatorGroup;

/**
 * The operators legal per operator group together with their label keys. Built once from
 * configuration; the filter-builder UI reads the same table through {@link #asTable()}.
 */
public class OperatorVocabulary {

  private static final String GROUPS_CONFIG_KEY = "groups";
  private static final String LABELS_CONFIG_KEY = "labels";

  private final Map<OperatorGroup, Map<Operator, String>> operatorsByGroup;

  OperatorVocabulary(Map<OperatorGroup, Map<Operator, String>> operatorsByGroup) {
    this.operatorsByGroup = operatorsByGroup;
  }

  /**
   * Parses the {@code groups} and {@code labels} sections. Unknown operators and operators
   * without a label are rejected here rather than when a report is compiled.
   */
  public static OperatorVocabulary parse(Config config) {
    Config groupsConfig = config.getConfig(GROUPS_CONFIG_KEY);
    Config labelsConfig = config.getConfig(LABELS_CONFIG_KEY);

    Map<OperatorGroup, Map<Operator, String>> operatorsByGroup = new EnumMap<>(OperatorGroup.class);
    for (OperatorGroup group : OperatorGroup.values()) {
      ImmutableMap.Builder<Operator, String> operators = ImmutableMap.builder();
      for (String operatorKey : groupsConfig.getStringList(group.getKey())) {
        Operator operator;
        try {
          operator = Operator.fromKey(operatorKey);
        } catch (IllegalArgumentException e) {
          throw new ConfigException.BadValue(
              groupsConfig.origin(), GROUPS_CONFIG_KEY + "." + group.getKey(), e.getMessage(), e);
        }
        operators.put(operator, labelsConfig.getString(operatorKey));
      }
      operatorsByGroup.put(group, operators.build());
    }
    return new OperatorVocabulary(ImmutableMap.copyOf(operatorsByGroup));
  }

  /** Operators of the group, in their configured order, mapped to their label keys. */
  public Map<Operator, String> getOperators(OperatorGroup group) {
    return operatorsByGroup.getOrDefault(group, Map.of());
  }

  /**
   * Operators a filter definition admits: its explicit list when it has one, else those of its
   * type's operator group.
   */
  public Set<Operator> getLegalOperators(FilterDefinition definition) {
    if (!definition.getOperators().isEmpty()) {
      return Set.copyOf(definition.getOperators());
    }
    return getOperators(definition.getType().getOperatorGroup()).keySet();
  }

  public boolean isLegal(FilterDefinition definition, Operator operator) {
    return getLegalOperators(definition).contains(operator);
  }

  /** The vocabulary as plain data: group key to operator key to label key. */
  public Map<String, Map<String, String>> asTable() {
    Map<String, Map<String, String>> table = new LinkedHashMap<>();
    operatorsByGroup.forEach(
        (group, operators) -> {
          Map<String, String> labels = new LinkedHashMap<>();
          operators.forEach((operator, label) -> labels.put(operator.getKey(), label));
          table.put(group.getKey(), ImmutableMap.copyOf(labels));
        });
    return ImmutableMap.copyOf(table);
  }
}
