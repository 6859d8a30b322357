package org.hypertrace.core.report.query.api;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import java.util.Arrays;
import java.util.List;

/** Semantic type of a report column or filter, as declared by the registering module. */
public enum SemanticType {
  BOOL(OperatorGroup.BOOL, "bool", "boolean"),
  INT(OperatorGroup.INT, "int", "integer"),
  FLOAT(OperatorGroup.INT, "float"),
  STRING(OperatorGroup.TEXT, "string"),
  EMAIL(OperatorGroup.TEXT, "email"),
  URL(OperatorGroup.TEXT, "url"),
  TEXT(OperatorGroup.TEXT, "text"),
  SELECT(OperatorGroup.SELECT, "select"),
  MULTISELECT(OperatorGroup.MULTISELECT, "multiselect"),
  DATE(OperatorGroup.DEFAULT, "date"),
  DATETIME(OperatorGroup.DEFAULT, "datetime"),
  TIME(OperatorGroup.DEFAULT, "time"),
  OTHER(OperatorGroup.DEFAULT, "other");

  private final OperatorGroup operatorGroup;
  private final List<String> keys;

  SemanticType(OperatorGroup operatorGroup, String... keys) {
    this.operatorGroup = operatorGroup;
    this.keys = List.of(keys);
  }

  @JsonValue
  public String getKey() {
    return keys.get(0);
  }

  public OperatorGroup getOperatorGroup() {
    return operatorGroup;
  }

  /** Date and time columns only ever compare against NULL, never against the empty string. */
  public boolean isTemporal() {
    return this == DATE || this == DATETIME;
  }

  /**
   * Resolves a type key. Keys not known to this enum map to {@link #OTHER} since registering
   * modules are free to invent presentation-only types.
   */
  @JsonCreator
  public static SemanticType fromKey(String key) {
    if (key == null) {
      return OTHER;
    }
    return Arrays.stream(values())
        .filter(type -> type.keys.contains(key))
        .findFirst()
        .orElse(OTHER);
  }
}
