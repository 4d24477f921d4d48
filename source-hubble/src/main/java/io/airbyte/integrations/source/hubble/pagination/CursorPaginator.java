/*
 * Copyright (c) 2020-2025 Airbyte, Inc., all rights reserved.
 */

package io.airbyte.integrations.source.hubble.pagination;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.airbyte.integrations.source.hubble.exception.MalformedResponseException;
import io.airbyte.integrations.source.hubble.state.SyncState;
import java.util.List;
import lombok.extern.slf4j.Slf4j;

/**
 * Pages through a dataset sorted by {@code _id}, using the last identifier of each page as the
 * lower bound of the next one. A short page ends the stream.
 */
@Slf4j
public class CursorPaginator implements Paginator {

  private final int pageSize;

  public CursorPaginator(final int pageSize) {
    this.pageSize = pageSize;
  }

  @Override
  public PageCursor firstPage() {
    return PageCursor.first(pageSize);
  }

  @Override
  public ObjectNode requestBody(final SyncState filterState, final PageCursor cursor) {
    return QueryBuilder.buildQuery(filterState, cursor);
  }

  @Override
  public PageDecision decide(final PageCursor cursor, final List<JsonNode> page, final SyncState syncState) {
    if (page.size() < cursor.pageSize()) {
      return new PageDecision.Done(syncState);
    }

    final JsonNode lastId = page.get(page.size() - 1).get(QueryBuilder.ID_FIELD);
    if (lastId == null || lastId.isNull() || lastId.asText().isEmpty()) {
      return new PageDecision.Failed(new MalformedResponseException(
          String.format("Last record of page %d has no %s, cannot continue pagination", cursor.pageNumber(), QueryBuilder.ID_FIELD)));
    }

    final String nextLastId = lastId.asText();
    if (cursor.lastId().isPresent()) {
      final String previous = cursor.lastId().get();
      if (previous.equals(nextLastId)) {
        return new PageDecision.Failed(new MalformedResponseException(
            String.format("Page %d ended on the same %s as the previous page (%s), the API ignored the cursor filter",
                cursor.pageNumber(), QueryBuilder.ID_FIELD, previous)));
      }
      if (nextLastId.compareTo(previous) < 0) {
        log.warn("{} went backwards between pages ({} -> {}), the API ordering may not match string ordering.",
            QueryBuilder.ID_FIELD, previous, nextLastId);
      }
    }
    return new PageDecision.Continue(cursor.advance(nextLastId));
  }

}
