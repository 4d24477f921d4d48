/*
 * Copyright (c) 2020-2025 Airbyte, Inc., all rights reserved.
 */

package io.airbyte.integrations.source.hubble.config;

import com.fasterxml.jackson.databind.JsonNode;
import com.google.common.io.Resources;
import com.networknt.schema.JsonSchema;
import com.networknt.schema.JsonSchemaFactory;
import com.networknt.schema.SpecVersion;
import com.networknt.schema.ValidationMessage;
import io.airbyte.integrations.source.hubble.exception.HubbleConfigurationException;
import io.airbyte.integrations.source.hubble.json.Jsons;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.util.Set;
import java.util.TreeSet;
import java.util.stream.Collectors;

/**
 * Validates raw configuration JSON against the {@code connectionSpecification} of the bundled
 * {@code spec.json} before it is parsed.
 */
public class ConfigValidator {

  public static final String SPEC_RESOURCE = "spec.json";

  private final JsonNode specification;
  private final JsonSchema configSchema;

  public ConfigValidator() {
    this(loadSpecification());
  }

  public ConfigValidator(final JsonNode specification) {
    this.specification = specification;
    this.configSchema = JsonSchemaFactory.getInstance(SpecVersion.VersionFlag.V7)
        .getSchema(specification.get("connectionSpecification"));
  }

  public static JsonNode loadSpecification() {
    try {
      return Jsons.deserialize(Resources.toString(Resources.getResource(SPEC_RESOURCE), StandardCharsets.UTF_8));
    } catch (final IOException e) {
      throw new UncheckedIOException("Unable to load " + SPEC_RESOURCE, e);
    }
  }

  public JsonNode getSpecification() {
    return specification;
  }

  /**
   * @param config raw configuration
   * @return validation messages, sorted; empty when the configuration is valid
   */
  public Set<String> validate(final JsonNode config) {
    return configSchema.validate(config).stream()
        .map(ValidationMessage::getMessage)
        .collect(Collectors.toCollection(TreeSet::new));
  }

  public void ensure(final JsonNode config) {
    final Set<String> errors = validate(config);
    if (!errors.isEmpty()) {
      throw new HubbleConfigurationException("Invalid configuration: " + String.join("; ", errors));
    }
  }

}
