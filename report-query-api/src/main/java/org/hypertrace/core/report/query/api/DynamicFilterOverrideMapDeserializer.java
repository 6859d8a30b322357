package org.hypertrace.core.report.query.api;

import com.fasterxml.jackson.core.JsonParser;
import com.fasterxml.jackson.databind.DeserializationContext;
import com.fasterxml.jackson.databind.JsonDeserializer;
import com.fasterxml.jackson.databind.JsonNode;
import java.io.IOException;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Map.Entry;

/**
 * Reads dynamic filter overrides either as a list of {@code {"column", "value"}} objects or as an
 * object already keyed by column. List entries are keyed by their column, the last one winning.
 */
public class DynamicFilterOverrideMapDeserializer
    extends JsonDeserializer<Map<String, DynamicFilterOverride>> {

  @Override
  public Map<String, DynamicFilterOverride> deserialize(
      JsonParser parser, DeserializationContext context) throws IOException {
    JsonNode node = parser.readValueAsTree();
    if (node == null || node.isNull()) {
      return Map.of();
    }
    Map<String, DynamicFilterOverride> overrides = new LinkedHashMap<>();
    if (node.isArray()) {
      for (JsonNode element : node) {
        DynamicFilterOverride override = toOverride(element, context);
        if (override.getColumn() == null) {
          return context.reportInputMismatch(
              DynamicFilterOverride.class, "Dynamic filter without column: %s", element);
        }
        overrides.put(override.getColumn(), override);
      }
      return Map.copyOf(overrides);
    }
    if (node.isObject()) {
      Iterator<Entry<String, JsonNode>> fields = node.fields();
      while (fields.hasNext()) {
        Entry<String, JsonNode> field = fields.next();
        overrides.put(field.getKey(), toOverride(field.getValue(), context));
      }
      return Map.copyOf(overrides);
    }
    return context.reportInputMismatch(
        Map.class, "Unsupported dynamic filters shape: %s", node.getNodeType());
  }

  @Override
  public Map<String, DynamicFilterOverride> getNullValue(DeserializationContext context) {
    return Map.of();
  }

  private DynamicFilterOverride toOverride(JsonNode node, DeserializationContext context)
      throws IOException {
    if (!node.isObject()) {
      return context.reportInputMismatch(
          DynamicFilterOverride.class, "Unsupported dynamic filter: %s", node);
    }
    return context.readTreeAsValue(node, DynamicFilterOverride.class);
  }
}
