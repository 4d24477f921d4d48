/*
 * Copyright (c) 2020-2025 Airbyte, Inc., all rights reserved.
 */

package io.airbyte.integrations.source.hubble.extract;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.airbyte.integrations.source.hubble.config.StreamSpec;
import io.airbyte.integrations.source.hubble.exception.HubbleException;
import io.airbyte.integrations.source.hubble.logging.StreamMdcScope;
import io.airbyte.integrations.source.hubble.pagination.PageCursor;
import io.airbyte.integrations.source.hubble.pagination.PageDecision;
import io.airbyte.integrations.source.hubble.protocol.ConnectorMessage;
import io.airbyte.integrations.source.hubble.schema.SchemaDocument;
import io.airbyte.integrations.source.hubble.state.SyncState;
import java.time.Clock;
import java.time.Duration;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.Consumer;
import lombok.extern.slf4j.Slf4j;

/**
 * Extracts one stream, page after page:
 *
 * <pre>
 * request -> sanitize -> decode -> (infer schema, first page) -> emit -> checkpoint -> decide
 * </pre>
 *
 * Pages are strictly sequential since each query depends on the previous page's last
 * {@code _id}. A STATE message is emitted after every page, so whatever ends the loop the host
 * holds the state of the last fully processed page. Instances are single-use and share nothing
 * with other loops; {@link #cancel()} is the only method meant to be called from another thread.
 */
@Slf4j
public class ExtractionLoop {

  private final StreamSpec stream;
  private final StreamComponents components;
  private final PageFetcher fetcher;
  private final Duration interPageDelay;
  private final Consumer<ConnectorMessage> output;
  private final Clock clock;
  private final AtomicBoolean cancelled = new AtomicBoolean(false);

  public ExtractionLoop(final StreamSpec stream,
                        final StreamComponents components,
                        final PageFetcher fetcher,
                        final Duration interPageDelay,
                        final Consumer<ConnectorMessage> output,
                        final Clock clock) {
    this.stream = stream;
    this.components = components;
    this.fetcher = fetcher;
    this.interPageDelay = interPageDelay;
    this.output = output;
    this.clock = clock;
  }

  /**
   * Stop before the next page is requested. The page in progress is finished first.
   */
  public void cancel() {
    cancelled.set(true);
  }

  /**
   * Run the stream to completion.
   *
   * @param initialState state handed over by the host, or built from the start date
   * @return outcome and the state to persist; failures are reported here, not thrown
   */
  public ExtractionResult run(final SyncState initialState) {
    try (final StreamMdcScope ignored = StreamMdcScope.forStream(stream.name())) {
      log.info("Starting stream {} from {} (updatedAt >= {}).", stream.name(), stream.endpointUrl(),
          initialState.highWaterMark().orElse("the beginning"));
      final ExtractionResult result = extract(initialState);
      log.info("Stream {} {}: {} record(s) in {} page(s), state {}.", stream.name(), result.status().name().toLowerCase(),
          result.recordsEmitted(), result.pagesRead(), result.finalState().toJson());
      return result;
    }
  }

  private ExtractionResult extract(final SyncState initialState) {
    // every page of this run filters on the state the run started from
    final SyncState filterState = initialState;
    final Progress progress = new Progress(initialState);
    PageCursor cursor = components.paginator().firstPage();

    while (true) {
      if (cancelled.get() || Thread.currentThread().isInterrupted()) {
        log.info("Stream {} cancelled before page {}.", stream.name(), cursor.pageNumber());
        return progress.result(ExtractionStatus.CANCELLED, null);
      }

      final ObjectNode body = components.paginator().requestBody(filterState, cursor);
      final DecodedPage page;
      try {
        page = fetcher.fetch(stream, body);
      } catch (final HubbleException e) {
        log.error("Stream {} failed on page {}.", stream.name(), cursor.pageNumber(), e);
        return progress.result(ExtractionStatus.FAILED, e);
      } catch (final InterruptedException e) {
        Thread.currentThread().interrupt();
        log.info("Stream {} interrupted while requesting page {}.", stream.name(), cursor.pageNumber());
        return progress.result(ExtractionStatus.CANCELLED, null);
      }

      progress.pagesRead++;
      progress.nullSequencesRemoved += page.nullSequencesRemoved();
      if (progress.schema == null) {
        progress.schema = components.schemaSource().schemaFor(page.records());
        log.info("Stream {}: schema has {} field(s).", stream.name(), progress.schema.properties().size());
      }

      SyncState pageState = progress.committed;
      for (final JsonNode record : page.records()) {
        output.accept(ConnectorMessage.record(stream.name(), record, clock.instant()));
        pageState = pageState.advance(record);
        progress.recordsEmitted++;
      }
      progress.committed = pageState;
      output.accept(ConnectorMessage.streamState(stream.name(), progress.committed.toJson()));
      log.debug("Stream {}: page {} done, {} record(s), checkpoint {}.", stream.name(), cursor.pageNumber(), page.size(),
          progress.committed.toJson());

      final PageDecision decision = components.paginator().decide(cursor, page.records(), progress.committed);
      if (decision instanceof PageDecision.Continue next) {
        cursor = next.next();
        pauseBetweenPages();
      } else if (decision instanceof PageDecision.Done) {
        return progress.result(ExtractionStatus.SUCCEEDED, null);
      } else if (decision instanceof PageDecision.Failed failed) {
        log.error("Stream {} cannot continue after page {}: {}", stream.name(), cursor.pageNumber(), failed.error().getMessage());
        return progress.result(ExtractionStatus.FAILED, failed.error());
      }
    }
  }

  private void pauseBetweenPages() {
    if (interPageDelay.isZero() || interPageDelay.isNegative()) {
      return;
    }
    try {
      Thread.sleep(interPageDelay.toMillis());
    } catch (final InterruptedException e) {
      // picked up as a cancellation before the next request
      Thread.currentThread().interrupt();
    }
  }

  /**
   * Counters of the current run. Only touched by the thread running the loop.
   */
  private final class Progress {

    private SyncState committed;
    private SchemaDocument schema;
    private long recordsEmitted;
    private int pagesRead;
    private int nullSequencesRemoved;

    private Progress(final SyncState initialState) {
      this.committed = initialState;
    }

    private ExtractionResult result(final ExtractionStatus status, final HubbleException error) {
      return new ExtractionResult(stream.name(), status, committed, recordsEmitted, pagesRead, nullSequencesRemoved,
          Optional.ofNullable(schema), Optional.ofNullable(error));
    }

  }

}
