/*
 * Copyright (c) 2020-2025 Airbyte, Inc., all rights reserved.
 */

package io.airbyte.integrations.source.hubble.config;

import com.fasterxml.jackson.databind.JsonNode;
import io.airbyte.integrations.source.hubble.exception.HubbleConfigurationException;
import java.time.Duration;
import java.time.OffsetDateTime;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import lombok.Builder;

/**
 * Connector configuration as entered by the user. Global settings are validated on
 * construction; endpoints are kept raw and turned into {@link StreamSpec}s per stream, so that one
 * broken endpoint only fails its own stream.
 */
@Builder(toBuilder = true)
public record HubbleSourceConfig(String apiToken,
                                 Optional<String> startDate,
                                 int pageSize,
                                 Duration interPageDelay,
                                 Duration requestTimeout,
                                 int maxRetries,
                                 List<EndpointConfig> endpoints) {

  public static final int DEFAULT_PAGE_SIZE = 200;
  public static final Duration DEFAULT_INTER_PAGE_DELAY = Duration.ofMillis(500);
  public static final Duration DEFAULT_REQUEST_TIMEOUT = Duration.ofSeconds(60);
  public static final int DEFAULT_MAX_RETRIES = 5;

  static final int MIN_PAGE_SIZE = 1;
  static final int MAX_PAGE_SIZE = 1000;
  static final Duration MAX_INTER_PAGE_DELAY = Duration.ofSeconds(30);
  static final Duration MIN_REQUEST_TIMEOUT = Duration.ofSeconds(10);
  static final Duration MAX_REQUEST_TIMEOUT = Duration.ofSeconds(300);
  static final int MIN_RETRIES = 1;
  static final int MAX_RETRIES = 10;

  /**
   * One entry of the {@code endpoints} list.
   */
  public record EndpointConfig(String name, String endpointUrl) {

    public StreamSpec toStreamSpec() {
      return StreamSpec.of(name, endpointUrl);
    }

  }

  public HubbleSourceConfig {
    if (apiToken == null || apiToken.isBlank()) {
      throw new HubbleConfigurationException("API token is not configured");
    }
    if (endpoints == null || endpoints.isEmpty()) {
      throw new HubbleConfigurationException("No endpoint configured");
    }
    startDate = startDate == null ? Optional.empty() : startDate.filter(date -> !date.isBlank());
    startDate.ifPresent(HubbleSourceConfig::validateStartDate);
    interPageDelay = interPageDelay == null ? DEFAULT_INTER_PAGE_DELAY : interPageDelay;
    requestTimeout = requestTimeout == null ? DEFAULT_REQUEST_TIMEOUT : requestTimeout;

    checkRange("page_size", pageSize, MIN_PAGE_SIZE, MAX_PAGE_SIZE);
    checkRange("max_retries", maxRetries, MIN_RETRIES, MAX_RETRIES);
    if (interPageDelay.isNegative() || interPageDelay.compareTo(MAX_INTER_PAGE_DELAY) > 0) {
      throw new HubbleConfigurationException(
          String.format("inter_page_delay must be between 0 and %d seconds, got %s", MAX_INTER_PAGE_DELAY.toSeconds(), interPageDelay));
    }
    if (requestTimeout.compareTo(MIN_REQUEST_TIMEOUT) < 0 || requestTimeout.compareTo(MAX_REQUEST_TIMEOUT) > 0) {
      throw new HubbleConfigurationException(String.format("request_timeout must be between %d and %d seconds, got %s",
          MIN_REQUEST_TIMEOUT.toSeconds(), MAX_REQUEST_TIMEOUT.toSeconds(), requestTimeout));
    }

    final Set<String> names = new HashSet<>();
    for (final EndpointConfig endpoint : endpoints) {
      if (endpoint.name() != null && !names.add(endpoint.name())) {
        throw new HubbleConfigurationException(String.format("Stream name '%s' is configured more than once", endpoint.name()));
      }
    }
    endpoints = List.copyOf(endpoints);
  }

  /**
   * Read the configuration JSON. Missing optional settings take their defaults.
   *
   * @param config the connector configuration object
   * @return validated configuration
   * @throws HubbleConfigurationException when a setting is missing or out of range
   */
  public static HubbleSourceConfig fromJson(final JsonNode config) {
    if (config == null || !config.isObject()) {
      throw new HubbleConfigurationException("Configuration must be a JSON object");
    }
    final List<EndpointConfig> endpoints = new ArrayList<>();
    for (final JsonNode endpoint : config.path("endpoints")) {
      endpoints.add(new EndpointConfig(endpoint.path("name").asText(null), endpoint.path("endpoint_url").asText(null)));
    }
    return new HubbleSourceConfig(
        config.path("api_token").asText(null),
        Optional.ofNullable(config.path("start_date").asText(null)),
        config.path("page_size").asInt(DEFAULT_PAGE_SIZE),
        config.has("inter_page_delay")
            ? Duration.ofMillis(Math.round(config.get("inter_page_delay").asDouble() * 1000))
            : DEFAULT_INTER_PAGE_DELAY,
        config.has("request_timeout")
            ? Duration.ofSeconds(config.get("request_timeout").asLong())
            : DEFAULT_REQUEST_TIMEOUT,
        config.path("max_retries").asInt(DEFAULT_MAX_RETRIES),
        endpoints);
  }

  private static void checkRange(final String setting, final int value, final int min, final int max) {
    if (value < min || value > max) {
      throw new HubbleConfigurationException(String.format("%s must be between %d and %d, got %d", setting, min, max, value));
    }
  }

  private static void validateStartDate(final String startDate) {
    try {
      OffsetDateTime.parse(startDate);
    } catch (final DateTimeParseException e) {
      throw new HubbleConfigurationException(
          String.format("start_date '%s' is not an ISO-8601 date-time such as 2024-01-01T00:00:00.000Z", startDate), e);
    }
  }

}
