/*
 * Copyright (c) 2020-2025 Airbyte, Inc., all rights reserved.
 */

package io.airbyte.integrations.source.hubble.exception;

/**
 * The API answered with a status that must not be retried (400, 401, 403, 404, ...). The status
 * and the response body are kept for diagnostics.
 */
public class FatalApiException extends HubbleException {

  private static final int MAX_BODY_IN_MESSAGE = 512;

  private final int statusCode;
  private final String responseBody;

  public FatalApiException(final int statusCode, final String responseBody) {
    super(String.format("API request failed with status %d: %s", statusCode, abbreviate(responseBody)));
    this.statusCode = statusCode;
    this.responseBody = responseBody;
  }

  protected FatalApiException(final String message, final int statusCode, final String responseBody, final Throwable cause) {
    super(message, cause);
    this.statusCode = statusCode;
    this.responseBody = responseBody;
  }

  public int getStatusCode() {
    return statusCode;
  }

  public String getResponseBody() {
    return responseBody;
  }

  @Override
  public FailureType getFailureType() {
    return statusCode == 401 || statusCode == 403 ? FailureType.CONFIG_ERROR : FailureType.SYSTEM_ERROR;
  }

  static String abbreviate(final String body) {
    if (body == null) {
      return "";
    }
    return body.length() <= MAX_BODY_IN_MESSAGE ? body : body.substring(0, MAX_BODY_IN_MESSAGE) + "...";
  }

}
