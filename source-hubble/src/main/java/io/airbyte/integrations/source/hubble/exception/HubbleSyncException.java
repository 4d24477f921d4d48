/*
 * Copyright (c) 2020-2025 Airbyte, Inc., all rights reserved.
 */

package io.airbyte.integrations.source.hubble.exception;

import java.util.List;

/**
 * Raised at the end of a read when at least one stream failed. The other streams were still
 * extracted.
 */
public class HubbleSyncException extends HubbleException {

  private final List<String> failedStreams;

  public HubbleSyncException(final List<String> failedStreams) {
    super("Sync finished with failed streams: " + String.join(", ", failedStreams));
    this.failedStreams = List.copyOf(failedStreams);
  }

  public List<String> getFailedStreams() {
    return failedStreams;
  }

  @Override
  public FailureType getFailureType() {
    return FailureType.SYSTEM_ERROR;
  }

}
