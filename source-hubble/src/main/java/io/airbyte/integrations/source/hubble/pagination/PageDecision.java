/*
 * Copyright (c) 2020-2025 Airbyte, Inc., all rights reserved.
 */

package io.airbyte.integrations.source.hubble.pagination;

import io.airbyte.integrations.source.hubble.exception.HubbleException;
import io.airbyte.integrations.source.hubble.state.SyncState;

/**
 * Outcome of processing one page: request the next one, stop, or fail.
 */
public sealed interface PageDecision {

  record Continue(PageCursor next) implements PageDecision {}

  record Done(SyncState finalState) implements PageDecision {}

  record Failed(HubbleException error) implements PageDecision {}

}
