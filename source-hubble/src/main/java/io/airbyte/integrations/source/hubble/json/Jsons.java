/*
 * Copyright (c) 2020-2025 Airbyte, Inc., all rights reserved.
 */

package io.airbyte.integrations.source.hubble.json;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.StreamReadConstraints;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.MapperFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.json.JsonMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.fasterxml.jackson.datatype.jdk8.Jdk8Module;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * JSON helpers shared by the connector. Every dynamic value (records, queries, state, schemas)
 * is a Jackson {@link JsonNode}.
 */
public final class Jsons {

  // response bodies can carry very large string fields
  private static final StreamReadConstraints STREAM_READ_CONSTRAINTS = StreamReadConstraints
      .builder()
      .maxStringLength(Integer.MAX_VALUE)
      .build();

  // ObjectMapper is thread-safe once configured
  private static final ObjectMapper OBJECT_MAPPER = initMapper();

  private Jsons() {}

  private static ObjectMapper initMapper() {
    final ObjectMapper mapper = JsonMapper.builder()
        .enable(MapperFeature.ACCEPT_CASE_INSENSITIVE_ENUMS)
        .disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES)
        .addModule(new JavaTimeModule())
        .addModule(new Jdk8Module())
        .build();
    mapper.getFactory().setStreamReadConstraints(STREAM_READ_CONSTRAINTS);
    return mapper;
  }

  public static ObjectMapper mapper() {
    return OBJECT_MAPPER;
  }

  /**
   * Serialize an object to a single-line JSON string.
   *
   * @param object to serialize
   * @return JSON text
   */
  public static String serialize(final Object object) {
    try {
      return OBJECT_MAPPER.writeValueAsString(object);
    } catch (final JsonProcessingException e) {
      throw new IllegalArgumentException("Unable to serialize " + object.getClass().getSimpleName(), e);
    }
  }

  /**
   * Parse JSON text into a tree.
   *
   * @param jsonString text to parse
   * @return parsed tree
   * @throws JsonProcessingException when the text is not valid JSON
   */
  public static JsonNode parse(final String jsonString) throws JsonProcessingException {
    return OBJECT_MAPPER.readTree(jsonString);
  }

  /**
   * Parse JSON text that is known to be valid (bundled resources, test fixtures).
   */
  public static JsonNode deserialize(final String jsonString) {
    try {
      return parse(jsonString);
    } catch (final JsonProcessingException e) {
      throw new IllegalArgumentException("Invalid JSON", e);
    }
  }

  public static JsonNode readFile(final Path path) {
    try {
      return deserialize(Files.readString(path, StandardCharsets.UTF_8));
    } catch (final IOException e) {
      throw new UncheckedIOException("Unable to read " + path, e);
    }
  }

  public static <T> JsonNode jsonNode(final T object) {
    return OBJECT_MAPPER.valueToTree(object);
  }

  public static ObjectNode emptyObject() {
    return JsonNodeFactory.instance.objectNode();
  }

  public static ArrayNode arrayNode() {
    return JsonNodeFactory.instance.arrayNode();
  }

}
