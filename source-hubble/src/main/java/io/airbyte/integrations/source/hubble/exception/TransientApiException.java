/*
 * Copyright (c) 2020-2025 Airbyte, Inc., all rights reserved.
 */

package io.airbyte.integrations.source.hubble.exception;

import java.time.Duration;
import java.util.Optional;

/**
 * A request failed in a way that is expected to heal by itself (rate limiting, 5xx, timeouts).
 * Only ever seen by the retry machinery unless it leaks out of a cancelled execution.
 */
public class TransientApiException extends HubbleException {

  private final Integer statusCode;
  private final Duration wait;

  public TransientApiException(final int statusCode, final Duration wait) {
    super(String.format("Transient API error, status %d, retrying in %s", statusCode, wait));
    this.statusCode = statusCode;
    this.wait = wait;
  }

  public TransientApiException(final Throwable transportCause, final Duration wait) {
    super(String.format("Transport error (%s), retrying in %s", transportCause.getMessage(), wait), transportCause);
    this.statusCode = null;
    this.wait = wait;
  }

  /**
   * HTTP status of the failed attempt, empty when the request never got a response.
   */
  public Optional<Integer> getStatusCode() {
    return Optional.ofNullable(statusCode);
  }

  public Duration getWait() {
    return wait;
  }

  @Override
  public FailureType getFailureType() {
    return FailureType.TRANSIENT_ERROR;
  }

}
