/*
 * Copyright (c) 2020-2025 Airbyte, Inc., all rights reserved.
 */

package io.airbyte.integrations.source.hubble.config;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.google.common.io.Resources;
import io.airbyte.integrations.source.hubble.config.HubbleSourceConfig.EndpointConfig;
import io.airbyte.integrations.source.hubble.exception.HubbleConfigurationException;
import io.airbyte.integrations.source.hubble.json.Jsons;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.List;
import java.util.Optional;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class HubbleSourceConfigTest {

  private ObjectNode config;

  @BeforeEach
  void setup() throws IOException {
    config = (ObjectNode) Jsons.deserialize(Resources.toString(Resources.getResource("config.json"), StandardCharsets.UTF_8));
  }

  @Test
  void testReadsEverySetting() {
    final HubbleSourceConfig parsed = HubbleSourceConfig.fromJson(config);

    assertEquals("test_token_123", parsed.apiToken());
    assertEquals(Optional.of("2024-01-01T00:00:00.000Z"), parsed.startDate());
    assertEquals(100, parsed.pageSize());
    assertEquals(Duration.ofMillis(250), parsed.interPageDelay());
    assertEquals(Duration.ofSeconds(30), parsed.requestTimeout());
    assertEquals(3, parsed.maxRetries());
    assertEquals(List.of(new EndpointConfig("vacancies", "https://hub.data2apis.com/dataset/all-hub-vacancies")),
        parsed.endpoints());
  }

  @Test
  void testDefaults() {
    final JsonNode minimal = Jsons.deserialize("""
                                               {"api_token":"t","endpoints":[{"name":"a","endpoint_url":"https://x.io/a"}]}
                                               """);

    final HubbleSourceConfig parsed = HubbleSourceConfig.fromJson(minimal);

    assertEquals(Optional.empty(), parsed.startDate());
    assertEquals(HubbleSourceConfig.DEFAULT_PAGE_SIZE, parsed.pageSize());
    assertEquals(HubbleSourceConfig.DEFAULT_INTER_PAGE_DELAY, parsed.interPageDelay());
    assertEquals(HubbleSourceConfig.DEFAULT_REQUEST_TIMEOUT, parsed.requestTimeout());
    assertEquals(HubbleSourceConfig.DEFAULT_MAX_RETRIES, parsed.maxRetries());
  }

  @Test
  void testMissingToken() {
    config.remove("api_token");

    assertThat(assertThrows(HubbleConfigurationException.class, () -> HubbleSourceConfig.fromJson(config)).getMessage())
        .contains("API token");
  }

  @Test
  void testNoEndpoint() {
    config.putArray("endpoints");

    assertThat(assertThrows(HubbleConfigurationException.class, () -> HubbleSourceConfig.fromJson(config)).getMessage())
        .contains("No endpoint");
  }

  @Test
  void testOutOfRangeSettings() {
    assertThrows(HubbleConfigurationException.class, () -> HubbleSourceConfig.fromJson(config.deepCopy().put("page_size", 0)));
    assertThrows(HubbleConfigurationException.class, () -> HubbleSourceConfig.fromJson(config.deepCopy().put("page_size", 1001)));
    assertThrows(HubbleConfigurationException.class, () -> HubbleSourceConfig.fromJson(config.deepCopy().put("max_retries", 11)));
    assertThrows(HubbleConfigurationException.class, () -> HubbleSourceConfig.fromJson(config.deepCopy().put("request_timeout", 5)));
    assertThrows(HubbleConfigurationException.class, () -> HubbleSourceConfig.fromJson(config.deepCopy().put("inter_page_delay", -1)));
  }

  @Test
  void testInvalidStartDate() {
    config.put("start_date", "last tuesday");

    assertThat(assertThrows(HubbleConfigurationException.class, () -> HubbleSourceConfig.fromJson(config)).getMessage())
        .contains("start_date");
  }

  @Test
  void testDuplicateStreamNames() {
    final HubbleSourceConfig parsed = HubbleSourceConfig.fromJson(config);
    final EndpointConfig endpoint = parsed.endpoints().get(0);

    assertThrows(HubbleConfigurationException.class, () -> parsed.toBuilder().endpoints(List.of(endpoint, endpoint)).build());
  }

  @Test
  void testInvalidEndpointIsOnlyRejectedWhenTurnedIntoAStream() {
    final HubbleSourceConfig parsed = HubbleSourceConfig.fromJson(config).toBuilder()
        .endpoints(List.of(new EndpointConfig("broken", "http://insecure.com/api")))
        .build();

    assertThrows(HubbleConfigurationException.class, () -> parsed.endpoints().get(0).toStreamSpec());
  }

}
