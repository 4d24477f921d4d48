/*
 * Copyright (c) 2020-2025 Airbyte, Inc., all rights reserved.
 */

package io.airbyte.integrations.source.hubble.pagination;

import com.fasterxml.jackson.databind.node.ObjectNode;
import io.airbyte.integrations.source.hubble.json.Jsons;
import io.airbyte.integrations.source.hubble.state.SyncState;

/**
 * Builds the POST body of a page request:
 *
 * <pre>
 * {"$method": "find", "params": {"query": {
 *     "$limit": pageSize,
 *     "$sort": {"_id": 1},
 *     "updatedAt": {"$gte": highWaterMark},   only with a high-water mark
 *     "_id": {"$gt": lastId}                  only from the second page on
 * }}}
 * </pre>
 *
 * No {@code $skip} is ever emitted. Rows inserted while a dataset is paged must still land on
 * some page, which only holds for the {@code _id} cursor.
 */
public final class QueryBuilder {

  public static final String ID_FIELD = "_id";
  static final String METHOD = "find";

  private QueryBuilder() {}

  public static ObjectNode buildQuery(final SyncState syncState, final PageCursor cursor) {
    return buildQuery(syncState, cursor, cursor.pageSize());
  }

  /**
   * @param syncState lower bound of the incremental filter
   * @param cursor where the previous page stopped
   * @param limit row limit of this request
   * @return request body
   */
  public static ObjectNode buildQuery(final SyncState syncState, final PageCursor cursor, final int limit) {
    final ObjectNode query = Jsons.emptyObject();
    query.put("$limit", limit);
    query.putObject("$sort").put(ID_FIELD, 1);
    syncState.highWaterMark().ifPresent(mark -> query.putObject(SyncState.CURSOR_FIELD).put("$gte", mark));
    cursor.lastId().ifPresent(lastId -> query.putObject(ID_FIELD).put("$gt", lastId));

    final ObjectNode body = Jsons.emptyObject();
    body.put("$method", METHOD);
    body.putObject("params").set("query", query);
    return body;
  }

}
