/*
 * Copyright (c) 2020-2025 Airbyte, Inc., all rights reserved.
 */

package io.airbyte.integrations.source.hubble.pagination;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.airbyte.integrations.source.hubble.state.SyncState;
import java.util.List;

/**
 * Decides what to request and whether there is more to request.
 */
public interface Paginator {

  PageCursor firstPage();

  ObjectNode requestBody(SyncState filterState, PageCursor cursor);

  /**
   * Called once a page has been fully emitted.
   *
   * @param cursor cursor the page was requested with
   * @param page records of the page, in response order
   * @param syncState state after emitting the page
   * @return what to do next
   */
  PageDecision decide(PageCursor cursor, List<JsonNode> page, SyncState syncState);

}
