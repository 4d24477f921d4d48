/*
 * Copyright (c) 2020-2025 Airbyte, Inc., all rights reserved.
 */

package io.airbyte.integrations.source.hubble.exception;

/**
 * Base class of every error raised by the connector.
 */
public abstract class HubbleException extends RuntimeException {

  protected HubbleException(final String message) {
    super(message);
  }

  protected HubbleException(final String message, final Throwable cause) {
    super(message, cause);
  }

  public abstract FailureType getFailureType();

}
