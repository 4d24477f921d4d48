/*
 * Copyright (c) 2020-2025 Airbyte, Inc., all rights reserved.
 */

package io.airbyte.integrations.source.hubble.extract;

import dev.failsafe.spi.Scheduler;
import io.airbyte.integrations.source.hubble.config.HubbleSourceConfig;
import io.airbyte.integrations.source.hubble.config.StreamSpec;
import io.airbyte.integrations.source.hubble.http.DefaultRetryPolicy;
import io.airbyte.integrations.source.hubble.http.HubbleApiClient;
import io.airbyte.integrations.source.hubble.http.PageRequester;
import io.airbyte.integrations.source.hubble.http.RetryPolicy;
import io.airbyte.integrations.source.hubble.pagination.CursorPaginator;
import io.airbyte.integrations.source.hubble.protocol.ConnectorMessage;
import io.airbyte.integrations.source.hubble.schema.InferringSchemaSource;
import io.micronaut.context.annotation.Value;
import jakarta.inject.Singleton;
import java.time.Clock;
import java.util.function.Consumer;
import okhttp3.OkHttpClient;

/**
 * Wires the per-configuration pieces of an extraction: authenticated client, retry policy,
 * paginator and schema source.
 */
@Singleton
public class ExtractionLoopFactory {

  private final OkHttpClient sharedClient;
  private final Scheduler scheduler;
  private final Clock clock;
  private final int schemaSampleSize;

  public ExtractionLoopFactory(final OkHttpClient sharedClient,
                               final Scheduler scheduler,
                               final Clock clock,
                               @Value("${airbyte.hubble.discover.sample-size:10}") final int schemaSampleSize) {
    this.sharedClient = sharedClient;
    this.scheduler = scheduler;
    this.clock = clock;
    this.schemaSampleSize = schemaSampleSize;
  }

  public StreamComponents components(final HubbleSourceConfig config) {
    return new StreamComponents(
        new CursorPaginator(config.pageSize()),
        new DefaultRetryPolicy(config.maxRetries(), clock),
        InferringSchemaSource.withDefaultFallback(schemaSampleSize));
  }

  /**
   * Fetcher for the given configuration and retry policy. {@code check} passes a policy without
   * retries.
   */
  public PageFetcher fetcher(final HubbleSourceConfig config, final RetryPolicy retryPolicy) {
    final HubbleApiClient apiClient = HubbleApiClient.create(sharedClient, config.apiToken(), config.requestTimeout());
    return new PageFetcher(new PageRequester(apiClient, retryPolicy, scheduler));
  }

  public ExtractionLoop loop(final HubbleSourceConfig config, final StreamSpec stream, final Consumer<ConnectorMessage> output) {
    final StreamComponents components = components(config);
    return new ExtractionLoop(stream, components, fetcher(config, components.retryPolicy()), config.interPageDelay(), output, clock);
  }

  public int getSchemaSampleSize() {
    return schemaSampleSize;
  }

  public Clock getClock() {
    return clock;
  }

}
