/*
 * Copyright (c) 2020-2025 Airbyte, Inc., all rights reserved.
 */

package io.airbyte.integrations.source.hubble.schema;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.airbyte.integrations.source.hubble.json.Jsons;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import lombok.extern.slf4j.Slf4j;

/**
 * Infers the schema from sample records and falls back to a static schema when there is nothing
 * to infer from.
 */
@Slf4j
public class InferringSchemaSource implements SchemaSource {

  private final SchemaDocument fallback;
  private final int maxSamples;

  public InferringSchemaSource(final SchemaDocument fallback, final int maxSamples) {
    if (fallback.isEmpty()) {
      throw new IllegalArgumentException("Fallback schema must declare at least one field");
    }
    if (maxSamples < 1) {
      throw new IllegalArgumentException("maxSamples must be positive, got " + maxSamples);
    }
    this.fallback = fallback;
    this.maxSamples = maxSamples;
  }

  public static InferringSchemaSource withDefaultFallback(final int maxSamples) {
    return new InferringSchemaSource(defaultFallback(), maxSamples);
  }

  /**
   * Identifier and timestamps every dataset of the API carries.
   */
  public static SchemaDocument defaultFallback() {
    final Map<String, ObjectNode> properties = new LinkedHashMap<>();
    for (final String field : List.of("_id", "updatedAt", "createdAt")) {
      final ObjectNode descriptor = Jsons.emptyObject();
      descriptor.putArray("type").add("null").add("string");
      properties.put(field, descriptor);
    }
    return new SchemaDocument(properties);
  }

  @Override
  public SchemaDocument schemaFor(final List<JsonNode> samples) {
    final List<JsonNode> window = samples.size() > maxSamples ? samples.subList(0, maxSamples) : samples;
    final SchemaDocument inferred = SchemaInferencer.inferSchema(window);
    if (inferred.isEmpty()) {
      log.info("No sample record available, using the static fallback schema.");
      return fallback;
    }
    log.debug("Inferred {} fields from {} sample record(s).", inferred.properties().size(), window.size());
    return inferred;
  }

}
