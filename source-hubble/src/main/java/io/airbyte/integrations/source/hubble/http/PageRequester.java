/*
 * Copyright (c) 2020-2025 Airbyte, Inc., all rights reserved.
 */

package io.airbyte.integrations.source.hubble.http;

import com.fasterxml.jackson.databind.node.ObjectNode;
import dev.failsafe.Failsafe;
import dev.failsafe.FailsafeException;
import dev.failsafe.spi.Scheduler;
import io.airbyte.integrations.source.hubble.exception.FatalApiException;
import io.airbyte.integrations.source.hubble.exception.RetriesExhaustedException;
import io.airbyte.integrations.source.hubble.exception.TransientApiException;
import java.io.IOException;
import java.time.Duration;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;
import lombok.extern.slf4j.Slf4j;
import okhttp3.HttpUrl;

/**
 * Sends one page request, retrying transient failures according to a {@link RetryPolicy}. Every
 * attempt posts the exact same body; the caller's cursor only moves once this returns.
 * <p>
 * Waits are scheduled by Failsafe on the given {@link Scheduler}. The calling thread blocks until
 * the request succeeds or fails for good, so there is never more than one attempt in flight.
 */
@Slf4j
public class PageRequester {

  private final HubbleApiClient apiClient;
  private final RetryPolicy retryPolicy;
  private final Scheduler scheduler;

  public PageRequester(final HubbleApiClient apiClient, final RetryPolicy retryPolicy, final Scheduler scheduler) {
    this.apiClient = apiClient;
    this.retryPolicy = retryPolicy;
    this.scheduler = scheduler;
  }

  /**
   * Post {@code body} to {@code url} until it succeeds.
   *
   * @param stream stream name, for logs
   * @param url dataset endpoint
   * @param body query body
   * @return the successful (2xx) response
   * @throws FatalApiException on a non-retryable status or when the retry budget is spent
   * @throws InterruptedException when the calling thread is interrupted while waiting
   */
  public ApiResponse execute(final String stream, final HttpUrl url, final ObjectNode body) throws InterruptedException {
    final dev.failsafe.RetryPolicy<ApiResponse> failsafePolicy = dev.failsafe.RetryPolicy.<ApiResponse>builder()
        .handle(TransientApiException.class)
        .withMaxRetries(retryPolicy.maxRetries())
        .withDelayFn(ctx -> ctx.getLastException() instanceof TransientApiException transientError
            ? transientError.getWait()
            : Duration.ZERO)
        .onRetry(event -> {
          final TransientApiException error = (TransientApiException) event.getLastException();
          log.warn("Stream {}: attempt {} failed ({}), retrying in {} s.",
              stream,
              event.getAttemptCount(),
              error.getStatusCode().map(String::valueOf).orElse("transport error"),
              error.getWait().toMillis() / 1000.0);
        })
        .build();

    final CompletableFuture<ApiResponse> response = Failsafe.with(failsafePolicy)
        .with(scheduler)
        .getAsync(ctx -> attempt(stream, url, body, ctx.getAttemptCount() + 1));
    try {
      return response.get();
    } catch (final InterruptedException e) {
      response.cancel(true);
      throw e;
    } catch (final ExecutionException e) {
      throw unwrap(e.getCause());
    }
  }

  private ApiResponse attempt(final String stream, final HttpUrl url, final ObjectNode body, final int attemptNumber) {
    log.debug("Stream {}: request attempt {} to {}.", stream, attemptNumber, url);
    final ApiResponse response;
    try {
      response = apiClient.post(url, body);
    } catch (final IOException e) {
      final RetryDecision decision = retryPolicy.decideOnTransportError(attemptNumber);
      if (decision.shouldRetry()) {
        throw new TransientApiException(e, decision.delay().orElse(Duration.ZERO));
      }
      throw new RetriesExhaustedException(attemptNumber, e);
    }

    if (response.isSuccessful()) {
      return response;
    }

    final RetryDecision decision = retryPolicy.decide(response.statusCode(), response.headers(), attemptNumber);
    if (decision.shouldRetry()) {
      throw new TransientApiException(response.statusCode(), decision.delay().orElse(Duration.ZERO));
    }
    if (retryPolicy.isRetryable(response.statusCode())) {
      throw new RetriesExhaustedException(attemptNumber, response.statusCode(), response.body());
    }
    log.error("Stream {}: request failed with non-retryable status {}.", stream, response.statusCode());
    throw new FatalApiException(response.statusCode(), response.body());
  }

  private RuntimeException unwrap(final Throwable failure) {
    Throwable cause = failure;
    while ((cause instanceof CompletionException || cause instanceof FailsafeException) && cause.getCause() != null) {
      cause = cause.getCause();
    }
    if (cause instanceof TransientApiException transientError) {
      // Failsafe ran out of retries before the policy did
      final int attempts = retryPolicy.maxRetries() + 1;
      return transientError.getStatusCode()
          .<RuntimeException>map(status -> new RetriesExhaustedException(attempts, status, null))
          .orElseGet(() -> new RetriesExhaustedException(attempts, transientError.getCause()));
    }
    if (cause instanceof RuntimeException runtimeException) {
      return runtimeException;
    }
    return new IllegalStateException("Unexpected failure while requesting a page", cause);
  }

}
