/*
 * Copyright (c) 2020-2025 Airbyte, Inc., all rights reserved.
 */

package io.airbyte.integrations.source.hubble.http;

import okhttp3.Headers;

/**
 * Decides, per failed attempt, whether a request is retried and how long to wait first. Attempt
 * numbers start at 1 for the first request.
 */
public interface RetryPolicy {

  RetryDecision decide(int statusCode, Headers headers, int attemptNumber);

  /**
   * The request got no response at all (timeout, reset connection, DNS failure).
   */
  RetryDecision decideOnTransportError(int attemptNumber);

  /**
   * Whether the status is transient at all, regardless of the attempt number. Used to tell an
   * exhausted retry budget from a fatal status.
   */
  boolean isRetryable(int statusCode);

  int maxRetries();

}
