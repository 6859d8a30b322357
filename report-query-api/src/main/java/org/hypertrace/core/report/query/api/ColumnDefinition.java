package org.hypertrace.core.report.query.api;

import java.util.Map;
import javax.annotation.Nullable;
import lombok.Builder;
import lombok.Singular;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

/**
 * Registry entry for a selectable report column. The column key itself is the raw {@code
 * table.column} reference; {@code formula} replaces it with an arbitrary SQL expression.
 */
@Value
@Jacksonized
@Builder(toBuilder = true)
public class ColumnDefinition {
  @Builder.Default SemanticType type = SemanticType.STRING;
  @Nullable String label;
  @Nullable String formula;
  @Nullable String groupByFormula;
  @Nullable String alias;
  @Nullable String prefix;
  @Nullable String suffix;

  /** Channel name to the column that channel contributes, in channel registration order. */
  @Singular("channel")
  Map<String, ChannelColumn> channelData;

  public boolean hasChannelData() {
    return !channelData.isEmpty();
  }
}
