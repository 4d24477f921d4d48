/*
 * Copyright (c) 2020-2025 Airbyte, Inc., all rights reserved.
 */

package io.airbyte.integrations.source.hubble.exception;

/**
 * A transient failure kept happening until the retry ceiling was reached. Fatal for the stream.
 */
public class RetriesExhaustedException extends FatalApiException {

  private static final int NO_STATUS = -1;

  private final int attempts;

  public RetriesExhaustedException(final int attempts, final int statusCode, final String responseBody) {
    super(String.format("Giving up after %d attempts, last status %d: %s", attempts, statusCode, abbreviate(responseBody)),
        statusCode, responseBody, null);
    this.attempts = attempts;
  }

  public RetriesExhaustedException(final int attempts, final Throwable transportCause) {
    super(String.format("Giving up after %d attempts, last transport error: %s", attempts, transportCause.getMessage()),
        NO_STATUS, null, transportCause);
    this.attempts = attempts;
  }

  public int getAttempts() {
    return attempts;
  }

  @Override
  public FailureType getFailureType() {
    return FailureType.TRANSIENT_ERROR;
  }

}
