/*
 * Copyright (c) 2020-2025 Airbyte, Inc., all rights reserved.
 */

package io.airbyte.integrations.source.hubble.schema;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.airbyte.integrations.source.hubble.json.Jsons;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Map.Entry;
import java.util.regex.Pattern;

/**
 * Derives JSON schema type descriptors from sample values. Every descriptor except the one for an
 * explicit null is nullable, since later pages or later syncs may omit the field.
 */
public final class SchemaInferencer {

  private static final Pattern DATE_TIME = Pattern.compile(
      "^\\d{4}-\\d{2}-\\d{2}[T ]\\d{2}:\\d{2}(:\\d{2}(\\.\\d{1,9})?)?(Z|[+-]\\d{2}(:?\\d{2})?)?$");

  private SchemaInferencer() {}

  /**
   * Map one decoded value to its descriptor. The node type acts as the tag: booleans and numbers
   * are distinct tags, so a boolean can never be mistaken for an integer.
   *
   * @param value decoded JSON value, a Java null is treated as JSON null
   * @return type descriptor
   */
  public static ObjectNode inferType(final JsonNode value) {
    if (value == null) {
      return nullDescriptor();
    }
    switch (value.getNodeType()) {
      case NULL:
      case MISSING:
        return nullDescriptor();
      case BOOLEAN:
        return nullable("boolean");
      case NUMBER:
        return nullable(value.isIntegralNumber() ? "integer" : "number");
      case STRING:
        final ObjectNode string = nullable("string");
        if (isDateTime(value.asText())) {
          string.put("format", "date-time");
        }
        return string;
      case ARRAY:
        final ObjectNode array = nullable("array");
        array.set("items", Jsons.emptyObject());
        return array;
      case OBJECT:
      case POJO:
        final ObjectNode object = nullable("object");
        object.put("additionalProperties", true);
        return object;
      case BINARY:
      default:
        return nullable("string");
    }
  }

  /**
   * Build a schema from sample records. The first record decides the field order and the type of
   * its fields; later samples only add fields not seen yet, or refine a field that was null in
   * every earlier sample.
   *
   * @param samples decoded records, non-object entries are ignored
   * @return the inferred schema, empty when no sample carries a field
   */
  public static SchemaDocument inferSchema(final List<JsonNode> samples) {
    final Map<String, ObjectNode> properties = new LinkedHashMap<>();
    for (final JsonNode sample : samples) {
      if (sample == null || !sample.isObject()) {
        continue;
      }
      final Iterator<Entry<String, JsonNode>> fields = sample.fields();
      while (fields.hasNext()) {
        final Entry<String, JsonNode> field = fields.next();
        final ObjectNode known = properties.get(field.getKey());
        if (known == null || (isNullDescriptor(known) && !field.getValue().isNull())) {
          properties.put(field.getKey(), inferType(field.getValue()));
        }
      }
    }
    return new SchemaDocument(properties);
  }

  static boolean isDateTime(final String text) {
    return DATE_TIME.matcher(text).matches();
  }

  private static ObjectNode nullDescriptor() {
    final ObjectNode descriptor = Jsons.emptyObject();
    descriptor.put("type", "null");
    return descriptor;
  }

  private static boolean isNullDescriptor(final ObjectNode descriptor) {
    return descriptor.path("type").isTextual() && "null".equals(descriptor.get("type").asText());
  }

  private static ObjectNode nullable(final String type) {
    final ObjectNode descriptor = Jsons.emptyObject();
    descriptor.putArray("type").add("null").add(type);
    return descriptor;
  }

}
