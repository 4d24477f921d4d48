/*
 * Copyright (c) 2020-2025 Airbyte, Inc., all rights reserved.
 */

package io.airbyte.integrations.source.hubble.pagination;

import com.google.common.base.Preconditions;
import java.util.Optional;

/**
 * Position of one stream's pagination within a single invocation.
 *
 * @param lastId identifier of the last record of the previous page, empty on the first page
 * @param pageSize maximum number of records requested per page
 * @param pageNumber 1-based number of the page this cursor requests
 */
public record PageCursor(Optional<String> lastId, int pageSize, int pageNumber) {

  public PageCursor {
    Preconditions.checkArgument(pageSize > 0, "pageSize must be positive, got %s", pageSize);
    Preconditions.checkArgument(pageNumber > 0, "pageNumber must be positive, got %s", pageNumber);
  }

  public static PageCursor first(final int pageSize) {
    return new PageCursor(Optional.empty(), pageSize, 1);
  }

  public boolean isFirstPage() {
    return lastId.isEmpty();
  }

  /**
   * Cursor for the page that follows the one ending with {@code newLastId}.
   */
  public PageCursor advance(final String newLastId) {
    Preconditions.checkArgument(newLastId != null && !newLastId.isEmpty(), "lastId must not be empty");
    return new PageCursor(Optional.of(newLastId), pageSize, pageNumber + 1);
  }

}
