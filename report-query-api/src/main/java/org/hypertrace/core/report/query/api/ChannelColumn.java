package org.hypertrace.core.report.query.api;

import javax.annotation.Nullable;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

/** The column a single channel contributes to a cross-channel report column. */
@Value
@Jacksonized
@Builder
public class ChannelColumn {
  String column;
  @Nullable String prefix;
}
