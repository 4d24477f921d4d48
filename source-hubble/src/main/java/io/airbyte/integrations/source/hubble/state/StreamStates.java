/*
 * Copyright (c) 2020-2025 Airbyte, Inc., all rights reserved.
 */

package io.airbyte.integrations.source.hubble.state;

import com.fasterxml.jackson.databind.JsonNode;
import io.airbyte.integrations.source.hubble.exception.HubbleConfigurationException;
import java.util.HashMap;
import java.util.Iterator;
import java.util.Map;
import java.util.Map.Entry;
import lombok.extern.slf4j.Slf4j;

/**
 * Reads the input state handed over by the host into one state object per stream name. Two shapes
 * are accepted:
 * <ul>
 * <li>a list of per-stream state messages,
 * {@code [{"type":"STREAM","stream":{"stream_descriptor":{"name":"x"},"stream_state":{...}}}]}</li>
 * <li>a legacy object keyed by stream name, {@code {"x": {"updatedAt": "..."}}}</li>
 * </ul>
 */
@Slf4j
public final class StreamStates {

  private StreamStates() {}

  public static Map<String, JsonNode> parse(final JsonNode input) {
    final Map<String, JsonNode> states = new HashMap<>();
    if (input == null || input.isNull() || input.isMissingNode()) {
      return states;
    }
    if (input.isArray()) {
      for (final JsonNode message : input) {
        final JsonNode stream = message.path("stream");
        final String name = stream.path("stream_descriptor").path("name").asText(null);
        if (name == null) {
          log.warn("Ignoring state entry without a stream descriptor: {}", message);
          continue;
        }
        states.put(name, stream.path("stream_state"));
      }
    } else if (input.isObject()) {
      final Iterator<Entry<String, JsonNode>> fields = input.fields();
      while (fields.hasNext()) {
        final Entry<String, JsonNode> field = fields.next();
        states.put(field.getKey(), field.getValue());
      }
    } else {
      throw new HubbleConfigurationException("Input state must be a JSON array or object, got " + input.getNodeType());
    }
    return states;
  }

}
