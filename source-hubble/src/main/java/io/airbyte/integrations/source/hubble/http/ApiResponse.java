/*
 * Copyright (c) 2020-2025 Airbyte, Inc., all rights reserved.
 */

package io.airbyte.integrations.source.hubble.http;

import okhttp3.Headers;

/**
 * A fully read HTTP response. The body is the raw, unsanitized text.
 */
public record ApiResponse(int statusCode, Headers headers, String body) {

  public boolean isSuccessful() {
    return statusCode >= 200 && statusCode < 300;
  }

}
