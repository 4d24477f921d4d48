/*
 * Copyright (c) 2020-2025 Airbyte, Inc., all rights reserved.
 */

package io.airbyte.integrations.source.hubble.exception;

/**
 * The response body could not be turned into a page of records, even after sanitization.
 * Retrying would fetch the same payload, so this is fatal.
 */
public class MalformedResponseException extends HubbleException {

  public MalformedResponseException(final String message) {
    super(message);
  }

  public MalformedResponseException(final String message, final Throwable cause) {
    super(message, cause);
  }

  @Override
  public FailureType getFailureType() {
    return FailureType.SYSTEM_ERROR;
  }

}
