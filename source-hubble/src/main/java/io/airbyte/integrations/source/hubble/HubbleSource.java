/*
 * Copyright (c) 2020-2025 Airbyte, Inc., all rights reserved.
 */

package io.airbyte.integrations.source.hubble;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.airbyte.integrations.source.hubble.config.ConfigValidator;
import io.airbyte.integrations.source.hubble.config.HubbleSourceConfig;
import io.airbyte.integrations.source.hubble.config.HubbleSourceConfig.EndpointConfig;
import io.airbyte.integrations.source.hubble.config.StreamSpec;
import io.airbyte.integrations.source.hubble.exception.FailureType;
import io.airbyte.integrations.source.hubble.exception.HubbleConfigurationException;
import io.airbyte.integrations.source.hubble.exception.HubbleException;
import io.airbyte.integrations.source.hubble.exception.HubbleSyncException;
import io.airbyte.integrations.source.hubble.extract.DecodedPage;
import io.airbyte.integrations.source.hubble.extract.ExtractionLoop;
import io.airbyte.integrations.source.hubble.extract.ExtractionLoopFactory;
import io.airbyte.integrations.source.hubble.extract.ExtractionResult;
import io.airbyte.integrations.source.hubble.extract.ExtractionStatus;
import io.airbyte.integrations.source.hubble.extract.PageFetcher;
import io.airbyte.integrations.source.hubble.extract.StreamComponents;
import io.airbyte.integrations.source.hubble.http.DefaultRetryPolicy;
import io.airbyte.integrations.source.hubble.json.Jsons;
import io.airbyte.integrations.source.hubble.logging.StreamMdcScope;
import io.airbyte.integrations.source.hubble.pagination.PageCursor;
import io.airbyte.integrations.source.hubble.pagination.QueryBuilder;
import io.airbyte.integrations.source.hubble.protocol.ConnectorMessage;
import io.airbyte.integrations.source.hubble.schema.SchemaDocument;
import io.airbyte.integrations.source.hubble.state.StreamStates;
import io.airbyte.integrations.source.hubble.state.SyncState;
import jakarta.inject.Inject;
import jakarta.inject.Singleton;
import java.time.Clock;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.function.Consumer;
import lombok.extern.slf4j.Slf4j;

/**
 * The four connector operations: {@code spec}, {@code check}, {@code discover} and {@code read}.
 * Every configured endpoint is one stream.
 */
@Slf4j
@Singleton
public class HubbleSource {

  static final String FULL_REFRESH = "full_refresh";
  static final String INCREMENTAL = "incremental";

  private final ConfigValidator configValidator;
  private final ExtractionLoopFactory loopFactory;
  private final Clock clock;

  @Inject
  public HubbleSource(final ExtractionLoopFactory loopFactory) {
    this(new ConfigValidator(), loopFactory);
  }

  HubbleSource(final ConfigValidator configValidator, final ExtractionLoopFactory loopFactory) {
    this.configValidator = configValidator;
    this.loopFactory = loopFactory;
    this.clock = loopFactory.getClock();
  }

  public ConnectorMessage spec() {
    return ConnectorMessage.spec(configValidator.getSpecification());
  }

  /**
   * Request a single record from every configured endpoint, without retries.
   *
   * @param rawConfig connector configuration
   * @return {@code SUCCEEDED}, or {@code FAILED} with the first problem found
   * @throws InterruptedException when interrupted during a request
   */
  public ConnectorMessage check(final JsonNode rawConfig) throws InterruptedException {
    final HubbleSourceConfig config;
    try {
      config = parseConfig(rawConfig);
    } catch (final HubbleConfigurationException e) {
      log.error("Connection check failed: {}", e.getMessage());
      return ConnectorMessage.connectionStatus(false, e.getMessage());
    }

    final PageFetcher fetcher = loopFactory.fetcher(config, new DefaultRetryPolicy(0, clock));
    for (final EndpointConfig endpoint : config.endpoints()) {
      try {
        final StreamSpec stream = endpoint.toStreamSpec();
        fetcher.fetch(stream, QueryBuilder.buildQuery(SyncState.empty(), PageCursor.first(1)));
        log.info("Endpoint {} of stream {} is reachable.", stream.endpointUrl(), stream.name());
      } catch (final HubbleException e) {
        log.error("Connection check failed for stream {}: {}", endpoint.name(), e.getMessage());
        return ConnectorMessage.connectionStatus(false, String.format("Stream %s: %s", endpoint.name(), e.getMessage()));
      }
    }
    return ConnectorMessage.connectionStatus(true, null);
  }

  /**
   * Build the catalog. Each valid endpoint is sampled once to infer its schema; endpoints that fail
   * validation are left out.
   *
   * @param rawConfig connector configuration
   * @return the catalog message
   * @throws HubbleException on invalid configuration or when the API rejects the credentials
   * @throws InterruptedException when interrupted during a request
   */
  public ConnectorMessage discover(final JsonNode rawConfig) throws InterruptedException {
    final HubbleSourceConfig config = parseConfig(rawConfig);
    final StreamComponents components = loopFactory.components(config);
    final PageFetcher fetcher = loopFactory.fetcher(config, components.retryPolicy());

    final ObjectNode catalog = Jsons.emptyObject();
    final ArrayNode streams = catalog.putArray("streams");
    for (final EndpointConfig endpoint : config.endpoints()) {
      final StreamSpec stream;
      try {
        stream = endpoint.toStreamSpec();
      } catch (final HubbleConfigurationException e) {
        log.warn("Skipping endpoint '{}' in the catalog: {}", endpoint.name(), e.getMessage());
        continue;
      }
      try (final StreamMdcScope ignored = StreamMdcScope.forStream(stream.name())) {
        streams.add(catalogEntry(stream.name(), sampleSchema(stream, components, fetcher).toJsonSchema()));
      }
    }
    log.info("Discovered {} stream(s).", streams.size());
    return ConnectorMessage.catalog(catalog);
  }

  private SchemaDocument sampleSchema(final StreamSpec stream, final StreamComponents components, final PageFetcher fetcher)
      throws InterruptedException {
    List<JsonNode> samples = List.of();
    try {
      final DecodedPage page = fetcher.fetch(stream,
          QueryBuilder.buildQuery(SyncState.empty(), PageCursor.first(loopFactory.getSchemaSampleSize())));
      samples = page.records();
    } catch (final HubbleException e) {
      if (e.getFailureType() == FailureType.CONFIG_ERROR) {
        throw e;
      }
      log.warn("Could not sample stream {}, using the static schema: {}", stream.name(), e.getMessage());
    }
    return components.schemaSource().schemaFor(samples);
  }

  static ObjectNode catalogEntry(final String name, final JsonNode jsonSchema) {
    final ObjectNode entry = Jsons.emptyObject();
    entry.put("name", name);
    entry.set("json_schema", jsonSchema);
    entry.putArray("supported_sync_modes").add(FULL_REFRESH).add(INCREMENTAL);
    entry.put("source_defined_cursor", true);
    entry.putArray("default_cursor_field").add(SyncState.CURSOR_FIELD);
    entry.putArray("source_defined_primary_key").addArray().add(QueryBuilder.ID_FIELD);
    return entry;
  }

  /**
   * Extract the selected streams one after the other. A failing stream is reported with an error
   * trace and does not stop the others.
   *
   * @param rawConfig connector configuration
   * @param configuredCatalog selected streams, or null for every configured endpoint
   * @param rawState state of the previous run, or null
   * @param output receives records, state checkpoints and traces
   * @throws HubbleSyncException when at least one stream failed
   */
  public void read(final JsonNode rawConfig, final JsonNode configuredCatalog, final JsonNode rawState,
                   final Consumer<ConnectorMessage> output) {
    final HubbleSourceConfig config = parseConfig(rawConfig);
    final Map<String, JsonNode> states = StreamStates.parse(rawState);
    final Map<String, String> selected = selectedStreams(configuredCatalog);

    final List<String> failedStreams = new ArrayList<>();
    for (final EndpointConfig endpoint : config.endpoints()) {
      if (selected != null && !selected.containsKey(endpoint.name())) {
        log.info("Stream {} is not selected, skipping.", endpoint.name());
        continue;
      }

      final StreamSpec stream;
      try {
        stream = endpoint.toStreamSpec();
      } catch (final HubbleConfigurationException e) {
        log.error("Stream {} is misconfigured: {}", endpoint.name(), e.getMessage());
        output.accept(ConnectorMessage.error(endpoint.name(), e.getMessage(), e, e.getFailureType(), clock.instant()));
        failedStreams.add(String.valueOf(endpoint.name()));
        continue;
      }

      final boolean fullRefresh = selected != null && FULL_REFRESH.equals(selected.get(stream.name()));
      final SyncState initialState = SyncState.restore(fullRefresh ? null : states.get(stream.name()), config.startDate());
      final ExtractionLoop loop = loopFactory.loop(config, stream, output);
      final ExtractionResult result = loop.run(initialState);
      if (result.nullSequencesRemoved() > 0) {
        output.accept(ConnectorMessage.log("WARN", String.format("Stream %s: removed %d null sequence(s) from API responses.",
            stream.name(), result.nullSequencesRemoved())));
      }

      if (result.status() == ExtractionStatus.CANCELLED) {
        log.info("Read cancelled during stream {}.", stream.name());
        break;
      }
      if (!result.succeeded()) {
        final HubbleException error = result.error().orElse(null);
        final String message = error == null ? "Extraction failed" : error.getMessage();
        output.accept(ConnectorMessage.error(stream.name(), message, error,
            error == null ? FailureType.SYSTEM_ERROR : error.getFailureType(), clock.instant()));
        failedStreams.add(stream.name());
      }
    }

    if (!failedStreams.isEmpty()) {
      throw new HubbleSyncException(failedStreams);
    }
  }

  private HubbleSourceConfig parseConfig(final JsonNode rawConfig) {
    configValidator.ensure(rawConfig);
    return HubbleSourceConfig.fromJson(rawConfig);
  }

  /**
   * @return stream name to sync mode, in catalog order, or null when no catalog was given
   */
  static Map<String, String> selectedStreams(final JsonNode configuredCatalog) {
    if (configuredCatalog == null || configuredCatalog.isNull() || configuredCatalog.isMissingNode()) {
      return null;
    }
    final Map<String, String> selected = new LinkedHashMap<>();
    for (final JsonNode configuredStream : configuredCatalog.path("streams")) {
      final String name = configuredStream.path("stream").path("name").asText(null);
      if (name == null) {
        throw new HubbleConfigurationException("Configured catalog contains a stream without a name");
      }
      selected.put(name, configuredStream.path("sync_mode").asText(INCREMENTAL));
    }
    return selected;
  }

}
