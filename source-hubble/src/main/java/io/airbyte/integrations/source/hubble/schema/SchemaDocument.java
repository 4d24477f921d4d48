/*
 * Copyright (c) 2020-2025 Airbyte, Inc., all rights reserved.
 */

package io.airbyte.integrations.source.hubble.schema;

import com.fasterxml.jackson.databind.node.ObjectNode;
import io.airbyte.integrations.source.hubble.json.Jsons;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Field name to type descriptor, in first-seen order. The JSON form always allows additional
 * properties so that fields missing from the sample still validate.
 */
public record SchemaDocument(Map<String, ObjectNode> properties) {

  public static final String JSON_SCHEMA_DRAFT_07 = "http://json-schema.org/draft-07/schema#";

  public SchemaDocument {
    properties = Collections.unmodifiableMap(new LinkedHashMap<>(properties));
  }

  public boolean isEmpty() {
    return properties.isEmpty();
  }

  public Optional<ObjectNode> descriptor(final String field) {
    return Optional.ofNullable(properties.get(field));
  }

  public ObjectNode toJsonSchema() {
    final ObjectNode schema = Jsons.emptyObject();
    schema.put("$schema", JSON_SCHEMA_DRAFT_07);
    schema.put("type", "object");
    final ObjectNode props = schema.putObject("properties");
    properties.forEach((name, descriptor) -> props.set(name, descriptor.deepCopy()));
    schema.put("additionalProperties", true);
    return schema;
  }

}
