/*
 * Copyright (c) 2020-2025 Airbyte, Inc., all rights reserved.
 */

package io.airbyte.integrations.source.hubble.http;

import com.google.common.base.Preconditions;
import com.google.common.net.HttpHeaders;
import java.time.Clock;
import java.time.Duration;
import java.time.ZonedDateTime;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.util.Optional;
import java.util.Set;
import java.util.regex.Pattern;
import lombok.extern.slf4j.Slf4j;
import okhttp3.Headers;

/**
 * Retry rules of the Hubble API:
 * <ul>
 * <li>429 waits for {@code Retry-After} (seconds or HTTP date), 60 seconds when absent or
 * unreadable, never more than {@link #MAX_RETRY_AFTER};</li>
 * <li>500, 502, 503, 504 and transport errors back off for {@code 2^attempt} seconds;</li>
 * <li>any other status is fatal;</li>
 * <li>once {@code maxRetries} retries have been spent the next failure is fatal.</li>
 * </ul>
 */
@Slf4j
public class DefaultRetryPolicy implements RetryPolicy {

  public static final int DEFAULT_MAX_RETRIES = 5;
  public static final Duration RATE_LIMIT_FALLBACK_WAIT = Duration.ofSeconds(60);
  public static final Duration MAX_RETRY_AFTER = Duration.ofMinutes(10);

  static final int TOO_MANY_REQUESTS = 429;
  private static final Set<Integer> SERVER_ERRORS = Set.of(500, 502, 503, 504);
  private static final Pattern DELTA_SECONDS = Pattern.compile("^\\d+(\\.\\d+)?$");

  private final int maxRetries;
  private final Clock clock;

  public DefaultRetryPolicy(final int maxRetries, final Clock clock) {
    Preconditions.checkArgument(maxRetries >= 0, "maxRetries must not be negative, got %s", maxRetries);
    this.maxRetries = maxRetries;
    this.clock = clock;
  }

  public DefaultRetryPolicy(final int maxRetries) {
    this(maxRetries, Clock.systemUTC());
  }

  @Override
  public RetryDecision decide(final int statusCode, final Headers headers, final int attemptNumber) {
    if (!isRetryable(statusCode) || attemptNumber > maxRetries) {
      return RetryDecision.giveUp();
    }
    if (statusCode == TOO_MANY_REQUESTS) {
      return RetryDecision.retryAfter(capped(retryAfter(headers).orElse(RATE_LIMIT_FALLBACK_WAIT)));
    }
    return RetryDecision.retryAfter(backoff(attemptNumber));
  }

  @Override
  public RetryDecision decideOnTransportError(final int attemptNumber) {
    return attemptNumber > maxRetries ? RetryDecision.giveUp() : RetryDecision.retryAfter(backoff(attemptNumber));
  }

  @Override
  public boolean isRetryable(final int statusCode) {
    return statusCode == TOO_MANY_REQUESTS || SERVER_ERRORS.contains(statusCode);
  }

  @Override
  public int maxRetries() {
    return maxRetries;
  }

  static Duration backoff(final int attemptNumber) {
    return Duration.ofSeconds(1L << Math.min(Math.max(attemptNumber, 0), 30));
  }

  private static Duration capped(final Duration requested) {
    if (requested.compareTo(MAX_RETRY_AFTER) > 0) {
      log.warn("Retry-After of {}s exceeds the maximum, waiting {}s instead.", requested.getSeconds(), MAX_RETRY_AFTER.getSeconds());
      return MAX_RETRY_AFTER;
    }
    return requested;
  }

  Optional<Duration> retryAfter(final Headers headers) {
    final String value = headers == null ? null : headers.get(HttpHeaders.RETRY_AFTER);
    if (value == null || value.isBlank()) {
      return Optional.empty();
    }
    final String trimmed = value.trim();
    if (DELTA_SECONDS.matcher(trimmed).matches()) {
      return Optional.of(Duration.ofMillis(Math.round(Double.parseDouble(trimmed) * 1000)));
    }
    try {
      final ZonedDateTime date = ZonedDateTime.parse(trimmed, DateTimeFormatter.RFC_1123_DATE_TIME);
      final Duration untilDate = Duration.between(clock.instant(), date.toInstant());
      return Optional.of(untilDate.isNegative() ? Duration.ZERO : untilDate);
    } catch (final DateTimeParseException e) {
      return Optional.empty();
    }
  }

}
