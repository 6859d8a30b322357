package org.hypertrace.core.report.query.api;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import java.util.Arrays;

/** Named operator sets published to the filter-builder UI. */
public enum OperatorGroup {
  DEFAULT("default"),
  BOOL("bool"),
  INT("int"),
  MULTISELECT("multiselect"),
  SELECT("select"),
  TEXT("text");

  private final String key;

  OperatorGroup(String key) {
    this.key = key;
  }

  @JsonValue
  public String getKey() {
    return key;
  }

  @JsonCreator
  public static OperatorGroup fromKey(String key) {
    return Arrays.stream(values())
        .filter(group -> group.key.equals(key))
        .findFirst()
        .orElseThrow(() -> new IllegalArgumentException("Unknown operator group: " + key));
  }
}
