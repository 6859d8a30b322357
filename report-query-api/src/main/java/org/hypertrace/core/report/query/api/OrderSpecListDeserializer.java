package org.hypertrace.core.report.query.api;

import com.fasterxml.jackson.core.JsonParser;
import com.fasterxml.jackson.databind.DeserializationContext;
import com.fasterxml.jackson.databind.JsonDeserializer;
import com.fasterxml.jackson.databind.JsonNode;
import java.io.IOException;
import java.util.ArrayList;
import java.util.List;

/**
 * Reads an ordering override given in any of its accepted shapes, tried in this order: a {@code
 * {"column", "direction"}} object, a {@code [column, direction]} pair, a list of bare order specs
 * (strings or objects), or a single bare column.
 */
public class OrderSpecListDeserializer extends JsonDeserializer<List<OrderSpec>> {

  @Override
  public List<OrderSpec> deserialize(JsonParser parser, DeserializationContext context)
      throws IOException {
    JsonNode node = parser.readValueAsTree();
    if (node == null || node.isNull()) {
      return List.of();
    }
    if (node.isObject()) {
      return List.of(toOrderSpec(node, context));
    }
    if (node.isArray()) {
      if (isColumnDirectionPair(node)) {
        return List.of(
            OrderSpec.of(node.get(0).asText(), SortOrder.fromString(node.get(1).asText())));
      }
      List<OrderSpec> orderSpecs = new ArrayList<>(node.size());
      for (JsonNode element : node) {
        orderSpecs.add(toOrderSpec(element, context));
      }
      return List.copyOf(orderSpecs);
    }
    if (node.isTextual()) {
      return node.asText().isBlank() ? List.of() : List.of(OrderSpec.of(node.asText(), null));
    }
    return context.reportInputMismatch(
        List.class, "Unsupported order shape: %s", node.getNodeType());
  }

  @Override
  public List<OrderSpec> getNullValue(DeserializationContext context) {
    return List.of();
  }

  private boolean isColumnDirectionPair(JsonNode node) {
    return node.size() == 2
        && node.get(0).isTextual()
        && node.get(1).isTextual()
        && SortOrder.isSortOrder(node.get(1).asText());
  }

  private OrderSpec toOrderSpec(JsonNode node, DeserializationContext context) throws IOException {
    if (node.isTextual()) {
      return OrderSpec.of(node.asText(), null);
    }
    if (node.isObject() && node.hasNonNull("column")) {
      JsonNode direction = node.get("direction");
      return OrderSpec.of(
          node.get("column").asText(),
          direction == null || direction.isNull() ? null : SortOrder.fromString(direction.asText()));
    }
    return context.reportInputMismatch(OrderSpec.class, "Unsupported order spec: %s", node);
  }
}
