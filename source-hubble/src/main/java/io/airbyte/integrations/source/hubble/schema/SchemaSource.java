/*
 * Copyright (c) 2020-2025 Airbyte, Inc., all rights reserved.
 */

package io.airbyte.integrations.source.hubble.schema;

import com.fasterxml.jackson.databind.JsonNode;
import java.util.List;

/**
 * Supplies the schema of a stream from the records of its first page.
 */
public interface SchemaSource {

  /**
   * Never returns an empty schema, even when {@code samples} is empty.
   */
  SchemaDocument schemaFor(List<JsonNode> samples);

}
