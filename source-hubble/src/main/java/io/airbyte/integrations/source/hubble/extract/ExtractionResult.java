/*
 * Copyright (c) 2020-2025 Airbyte, Inc., all rights reserved.
 */

package io.airbyte.integrations.source.hubble.extract;

import io.airbyte.integrations.source.hubble.exception.HubbleException;
import io.airbyte.integrations.source.hubble.schema.SchemaDocument;
import io.airbyte.integrations.source.hubble.state.SyncState;
import java.util.Optional;

/**
 * What one stream extraction produced.
 *
 * @param stream stream name
 * @param status how the loop ended
 * @param finalState state as of the last fully processed page; hand it back on the next run
 * @param recordsEmitted records written to the output
 * @param pagesRead successful page responses
 * @param nullSequencesRemoved null escapes and characters stripped over all pages
 * @param schema schema discovered from the first page, empty if no page was read
 * @param error cause of a {@link ExtractionStatus#FAILED} extraction
 */
public record ExtractionResult(String stream,
                               ExtractionStatus status,
                               SyncState finalState,
                               long recordsEmitted,
                               int pagesRead,
                               int nullSequencesRemoved,
                               Optional<SchemaDocument> schema,
                               Optional<HubbleException> error) {

  public boolean succeeded() {
    return status == ExtractionStatus.SUCCEEDED;
  }

}
