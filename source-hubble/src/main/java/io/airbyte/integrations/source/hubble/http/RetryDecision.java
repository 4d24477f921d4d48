/*
 * Copyright (c) 2020-2025 Airbyte, Inc., all rights reserved.
 */

package io.airbyte.integrations.source.hubble.http;

import java.time.Duration;
import java.util.Optional;

/**
 * Whether a failed request is tried again, and after how long.
 *
 * @param shouldRetry retry the same request
 * @param delay time to wait before the retry, present iff {@code shouldRetry}
 */
public record RetryDecision(boolean shouldRetry, Optional<Duration> delay) {

  private static final RetryDecision GIVE_UP = new RetryDecision(false, Optional.empty());

  public static RetryDecision retryAfter(final Duration delay) {
    return new RetryDecision(true, Optional.of(delay));
  }

  public static RetryDecision giveUp() {
    return GIVE_UP;
  }

  /**
   * Wait in (possibly fractional) seconds, empty when not retrying.
   */
  public Optional<Double> waitSeconds() {
    return delay.map(duration -> duration.toMillis() / 1000.0);
  }

}
