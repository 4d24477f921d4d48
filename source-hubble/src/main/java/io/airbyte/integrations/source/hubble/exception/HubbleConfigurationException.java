/*
 * Copyright (c) 2020-2025 Airbyte, Inc., all rights reserved.
 */

package io.airbyte.integrations.source.hubble.exception;

/**
 * The connector configuration is unusable: bad stream name, non-HTTPS or unsafe endpoint URL,
 * missing token, empty endpoint list or an out-of-range setting. Raised before any request is
 * made and never retried.
 */
public class HubbleConfigurationException extends HubbleException {

  public HubbleConfigurationException(final String message) {
    super(message);
  }

  public HubbleConfigurationException(final String message, final Throwable cause) {
    super(message, cause);
  }

  @Override
  public FailureType getFailureType() {
    return FailureType.CONFIG_ERROR;
  }

}
