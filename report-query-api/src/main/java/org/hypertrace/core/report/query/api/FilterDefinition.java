package org.hypertrace.core.report.query.api;

import java.util.List;
import javax.annotation.Nullable;
import lombok.Builder;
import lombok.Singular;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

/**
 * Registry entry for a filterable report column. When {@code operators} is empty the operators
 * legal for the column are those of its type's {@link OperatorGroup}.
 */
@Value
@Jacksonized
@Builder
public class FilterDefinition {
  @Builder.Default SemanticType type = SemanticType.STRING;
  @Nullable String label;
  @Nullable String formula;
  @Singular List<Operator> operators;
}
