/*
 * Copyright (c) 2020-2025 Airbyte, Inc., all rights reserved.
 */

package io.airbyte.integrations.source.hubble;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.airbyte.integrations.source.hubble.exception.FatalApiException;
import io.airbyte.integrations.source.hubble.exception.HubbleConfigurationException;
import io.airbyte.integrations.source.hubble.exception.HubbleSyncException;
import io.airbyte.integrations.source.hubble.extract.ExtractionLoopFactory;
import io.airbyte.integrations.source.hubble.http.RecordingScheduler;
import io.airbyte.integrations.source.hubble.json.Jsons;
import io.airbyte.integrations.source.hubble.protocol.ConnectorMessage;
import io.airbyte.integrations.source.hubble.protocol.MessageType;
import java.io.IOException;
import java.net.InetAddress;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.TimeUnit;
import java.util.stream.Collectors;
import okhttp3.OkHttpClient;
import okhttp3.mockwebserver.Dispatcher;
import okhttp3.mockwebserver.MockResponse;
import okhttp3.mockwebserver.MockWebServer;
import okhttp3.mockwebserver.RecordedRequest;
import okhttp3.tls.HandshakeCertificates;
import okhttp3.tls.HeldCertificate;
import org.jetbrains.annotations.NotNull;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class HubbleSourceTest {

  private static final Clock CLOCK = Clock.fixed(Instant.parse("2024-06-01T00:00:00Z"), ZoneOffset.UTC);
  private static final String TOKEN = "test_token_123";
  private static final String VACANCIES_PATH = "/dataset/all-hub-vacancies";
  private static final String COMPANIES_PATH = "/dataset/all-hub-companies";

  private MockWebServer mockWebServer;
  private RecordingScheduler scheduler;
  private HubbleSource source;
  private final Map<String, MockResponse> overrides = new ConcurrentHashMap<>();

  @BeforeEach
  void setUp() throws IOException {
    final HeldCertificate certificate = new HeldCertificate.Builder()
        .addSubjectAlternativeName("localhost")
        .addSubjectAlternativeName(InetAddress.getByName("localhost").getCanonicalHostName())
        .build();
    final HandshakeCertificates serverCertificates = new HandshakeCertificates.Builder().heldCertificate(certificate).build();
    final HandshakeCertificates clientCertificates = new HandshakeCertificates.Builder()
        .addTrustedCertificate(certificate.certificate())
        .build();

    mockWebServer = new MockWebServer();
    mockWebServer.useHttps(serverCertificates.sslSocketFactory(), false);
    mockWebServer.setDispatcher(new HubbleDispatcher());
    mockWebServer.start();

    final OkHttpClient client = new OkHttpClient.Builder()
        .sslSocketFactory(clientCertificates.sslSocketFactory(), clientCertificates.trustManager())
        .retryOnConnectionFailure(false)
        .build();
    scheduler = new RecordingScheduler();
    source = new HubbleSource(new ExtractionLoopFactory(client, scheduler, CLOCK, 10));
  }

  @AfterEach
  void tearDown() throws IOException {
    scheduler.close();
    mockWebServer.shutdown();
  }

  @Test
  void testSpec() {
    final ConnectorMessage spec = source.spec();

    assertEquals(MessageType.SPEC, spec.getType());
    assertTrue(spec.getPayload().get("connectionSpecification").get("required").toString().contains("endpoints"));
  }

  @Test
  void testCheckSucceeds() throws InterruptedException {
    final ConnectorMessage status = source.check(config(false));

    assertEquals("SUCCEEDED", status.getPayload().get("status").asText());
    assertEquals(2, mockWebServer.getRequestCount());
    final RecordedRequest request = mockWebServer.takeRequest();
    assertEquals("Bearer " + TOKEN, request.getHeader("Authorization"));
    assertEquals(1, Jsons.deserialize(request.getBody().readUtf8()).get("params").get("query").get("$limit").asInt());
  }

  @Test
  void testCheckFailsOnRejectedToken() throws InterruptedException {
    overrides.put(VACANCIES_PATH, new MockResponse().setResponseCode(401).setBody("{\"message\":\"Unauthorized\"}"));

    final ConnectorMessage status = source.check(config(false));

    assertEquals("FAILED", status.getPayload().get("status").asText());
    assertThat(status.getPayload().get("message").asText()).contains("vacancies").contains("401");
    assertEquals(1, mockWebServer.getRequestCount());
  }

  @Test
  void testCheckDoesNotRetry() throws InterruptedException {
    overrides.put(VACANCIES_PATH, new MockResponse().setResponseCode(503));

    final ConnectorMessage status = source.check(config(false));

    assertEquals("FAILED", status.getPayload().get("status").asText());
    assertEquals(1, mockWebServer.getRequestCount());
    assertTrue(scheduler.getWaits().isEmpty());
  }

  @Test
  void testCheckFailsOnInsecureEndpoint() throws InterruptedException {
    final ConnectorMessage status = source.check(config(true));

    assertEquals("FAILED", status.getPayload().get("status").asText());
    assertThat(status.getPayload().get("message").asText()).contains("HTTPS");
  }

  @Test
  void testCheckFailsOnInvalidConfig() throws InterruptedException {
    final ObjectNode config = config(false);
    config.remove("api_token");

    final ConnectorMessage status = source.check(config);

    assertEquals("FAILED", status.getPayload().get("status").asText());
    assertEquals(0, mockWebServer.getRequestCount());
  }

  @Test
  void testDiscoverSkipsInvalidEndpoints() throws InterruptedException {
    final ConnectorMessage catalog = source.discover(config(true));

    assertEquals(MessageType.CATALOG, catalog.getType());
    final JsonNode streams = catalog.getPayload().get("streams");
    assertEquals(2, streams.size());

    final JsonNode vacancies = streams.get(0);
    assertEquals("vacancies", vacancies.get("name").asText());
    assertEquals(Jsons.deserialize("[\"full_refresh\",\"incremental\"]"), vacancies.get("supported_sync_modes"));
    assertTrue(vacancies.get("source_defined_cursor").asBoolean());
    assertEquals(Jsons.deserialize("[\"updatedAt\"]"), vacancies.get("default_cursor_field"));
    assertEquals(Jsons.deserialize("[[\"_id\"]]"), vacancies.get("source_defined_primary_key"));
    final JsonNode properties = vacancies.get("json_schema").get("properties");
    assertEquals(List.of("_id", "title", "salary", "updatedAt"), fieldNames(properties));
    assertEquals(Jsons.deserialize("[\"null\",\"integer\"]"), properties.get("salary").get("type"));
    assertEquals("date-time", properties.get("updatedAt").get("format").asText());

    final JsonNode companies = streams.get(1);
    assertEquals("companies", companies.get("name").asText());
    assertEquals(List.of("_id", "updatedAt", "createdAt"), fieldNames(companies.get("json_schema").get("properties")));
  }

  @Test
  void testDiscoverFailsOnRejectedToken() {
    overrides.put(VACANCIES_PATH, new MockResponse().setResponseCode(403));

    final FatalApiException error = assertThrows(FatalApiException.class, () -> source.discover(config(false)));

    assertEquals(403, error.getStatusCode());
  }

  @Test
  void testReadContinuesPastInvalidEndpoint() {
    final List<ConnectorMessage> messages = new ArrayList<>();

    final HubbleSyncException error = assertThrows(HubbleSyncException.class, () -> source.read(config(true), null, null, messages::add));

    assertEquals(List.of("broken"), error.getFailedStreams());
    assertEquals(List.of("1", "2", "3"), recordIds(messages, "vacancies"));
    assertTrue(recordIds(messages, "companies").isEmpty());

    final List<ConnectorMessage> traces = ofType(messages, MessageType.TRACE);
    assertEquals(1, traces.size());
    final JsonNode traceError = traces.get(0).getPayload().get("error");
    assertEquals("config_error", traceError.get("failure_type").asText());
    assertEquals("broken", traceError.get("stream_descriptor").get("name").asText());

    final List<ConnectorMessage> states = ofType(messages, MessageType.STATE);
    final JsonNode lastVacanciesState = states.stream()
        .map(ConnectorMessage::getPayload)
        .filter(state -> "vacancies".equals(state.get("stream").get("stream_descriptor").get("name").asText()))
        .reduce((first, second) -> second)
        .orElseThrow();
    assertEquals("2024-03-03T00:00:00.000Z", lastVacanciesState.get("stream").get("stream_state").get("updatedAt").asText());
  }

  @Test
  void testReadUsesSavedStateForIncrementalStreams() throws InterruptedException {
    final JsonNode state = Jsons.deserialize("""
                                             [{"type":"STREAM","stream":{"stream_descriptor":{"name":"vacancies"},
                                               "stream_state":{"updatedAt":"2024-03-01T00:00:00.000Z"}}}]
                                             """);
    final JsonNode catalog = Jsons.deserialize("""
                                               {"streams":[{"stream":{"name":"vacancies"},"sync_mode":"incremental"}]}
                                               """);

    source.read(config(false), catalog, state, message -> {});

    final JsonNode query = Jsons.deserialize(mockWebServer.takeRequest().getBody().readUtf8()).get("params").get("query");
    assertEquals("2024-03-01T00:00:00.000Z", query.get("updatedAt").get("$gte").asText());
    // companies is not in the catalog
    assertTrue(requestedPaths().stream().noneMatch(COMPANIES_PATH::equals));
  }

  @Test
  void testFullRefreshIgnoresSavedState() throws InterruptedException {
    final JsonNode state = Jsons.deserialize("{\"vacancies\":{\"updatedAt\":\"2024-03-01T00:00:00.000Z\"}}");
    final JsonNode catalog = Jsons.deserialize("{\"streams\":[{\"stream\":{\"name\":\"vacancies\"},\"sync_mode\":\"full_refresh\"}]}");
    final ObjectNode config = config(false);
    config.remove("start_date");

    source.read(config, catalog, state, message -> {});

    final JsonNode query = Jsons.deserialize(mockWebServer.takeRequest().getBody().readUtf8()).get("params").get("query");
    assertFalse(query.has("updatedAt"));
  }

  @Test
  void testReadReportsRemovedNullSequences() {
    overrides.put(VACANCIES_PATH, new MockResponse().setBody("{\"data\":[{\"_id\":\"1\",\"title\":\"A\\u0000B\"}]}"));
    final List<ConnectorMessage> messages = new ArrayList<>();

    source.read(config(false), null, null, messages::add);

    final JsonNode record = ofType(messages, MessageType.RECORD).get(0).getPayload().get("data");
    assertEquals("AB", record.get("title").asText());
    final List<ConnectorMessage> logs = ofType(messages, MessageType.LOG);
    assertEquals(1, logs.size());
    assertEquals("WARN", logs.get(0).getPayload().get("level").asText());
    assertThat(logs.get(0).getPayload().get("message").asText()).contains("vacancies").contains("1 null sequence");
  }

  @Test
  void testReadRejectsInvalidConfig() {
    final ObjectNode config = config(false);
    config.put("page_size", 0);

    assertThrows(HubbleConfigurationException.class, () -> source.read(config, null, null, message -> {}));
  }

  private ObjectNode config(final boolean withInsecureEndpoint) {
    final ObjectNode config = Jsons.emptyObject();
    config.put("api_token", TOKEN);
    config.put("start_date", "2024-01-01T00:00:00.000Z");
    config.put("page_size", 2);
    config.put("inter_page_delay", 0);
    config.put("request_timeout", 10);
    config.put("max_retries", 1);
    final ArrayNode endpoints = config.putArray("endpoints");
    endpoints.addObject().put("name", "vacancies").put("endpoint_url", mockWebServer.url(VACANCIES_PATH).toString());
    if (withInsecureEndpoint) {
      endpoints.addObject().put("name", "broken").put("endpoint_url", "http://insecure.example.com/dataset");
    }
    endpoints.addObject().put("name", "companies").put("endpoint_url", mockWebServer.url(COMPANIES_PATH).toString());
    return config;
  }

  private List<String> requestedPaths() throws InterruptedException {
    final List<String> paths = new ArrayList<>();
    RecordedRequest request;
    while ((request = mockWebServer.takeRequest(0, TimeUnit.SECONDS)) != null) {
      paths.add(request.getPath());
    }
    return paths;
  }

  private static List<String> fieldNames(final JsonNode properties) {
    final List<String> names = new ArrayList<>();
    properties.fieldNames().forEachRemaining(names::add);
    return names;
  }

  private static List<ConnectorMessage> ofType(final List<ConnectorMessage> messages, final MessageType type) {
    return messages.stream().filter(message -> message.getType() == type).collect(Collectors.toList());
  }

  private static List<String> recordIds(final List<ConnectorMessage> messages, final String stream) {
    return ofType(messages, MessageType.RECORD).stream()
        .map(ConnectorMessage::getPayload)
        .filter(record -> stream.equals(record.get("stream").asText()))
        .map(record -> record.get("data").get("_id").asText())
        .collect(Collectors.toList());
  }

  /**
   * Serves two vacancy pages (two records, then one) and an empty company dataset.
   */
  private class HubbleDispatcher extends Dispatcher {

    @NotNull
    @Override
    public MockResponse dispatch(@NotNull final RecordedRequest request) {
      final String path = request.getPath();
      if (overrides.containsKey(path)) {
        return overrides.get(path);
      }
      if (COMPANIES_PATH.equals(path)) {
        return new MockResponse().setBody("{\"data\":[],\"meta\":{\"count\":0}}");
      }
      if (!VACANCIES_PATH.equals(path)) {
        return new MockResponse().setResponseCode(404);
      }
      final JsonNode query = Jsons.deserialize(request.getBody().clone().readUtf8()).get("params").get("query");
      final int limit = query.get("$limit").asInt();
      final String afterId = query.path("_id").path("$gt").asText("");
      final ArrayNode data = Jsons.arrayNode();
      for (int id = 1; id <= 3 && data.size() < limit; id++) {
        if (String.valueOf(id).compareTo(afterId) > 0) {
          data.addObject()
              .put("_id", String.valueOf(id))
              .put("title", "Vacancy " + id)
              .put("salary", 1000 * id)
              .put("updatedAt", String.format("2024-03-%02dT00:00:00.000Z", id));
        }
      }
      final ObjectNode body = Jsons.emptyObject();
      body.set("data", data);
      return new MockResponse().setBody(Jsons.serialize(body));
    }

  }

}
