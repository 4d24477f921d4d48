/*
 * Copyright (c) 2020-2025 Airbyte, Inc., all rights reserved.
 */

package io.airbyte.integrations.source.hubble.http;

import com.fasterxml.jackson.databind.node.ObjectNode;
import io.airbyte.integrations.source.hubble.json.Jsons;
import java.io.IOException;
import java.time.Duration;
import okhttp3.HttpUrl;
import okhttp3.MediaType;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.RequestBody;
import okhttp3.Response;
import okhttp3.ResponseBody;

/**
 * Posts query bodies to a dataset endpoint and reads the answer back as text. Status handling is
 * left to the caller.
 */
public class HubbleApiClient {

  private static final MediaType JSON = MediaType.get("application/json; charset=utf-8");

  private final OkHttpClient okHttpClient;

  public HubbleApiClient(final OkHttpClient okHttpClient) {
    this.okHttpClient = okHttpClient;
  }

  /**
   * Derive an authenticated client from the shared one. Connection pool and dispatcher stay
   * shared.
   *
   * @param sharedClient application-wide client
   * @param apiToken bearer token
   * @param requestTimeout timeout of one full call, connect to end of body
   * @return client for one connector configuration
   */
  public static HubbleApiClient create(final OkHttpClient sharedClient, final String apiToken, final Duration requestTimeout) {
    return new HubbleApiClient(sharedClient.newBuilder()
        .callTimeout(requestTimeout)
        .readTimeout(requestTimeout)
        .addInterceptor(new BearerTokenInterceptor(apiToken))
        .build());
  }

  public ApiResponse post(final HttpUrl url, final ObjectNode body) throws IOException {
    final Request request = new Request.Builder()
        .url(url)
        .post(RequestBody.create(Jsons.serialize(body), JSON))
        .build();
    try (final Response response = okHttpClient.newCall(request).execute()) {
      final ResponseBody responseBody = response.body();
      return new ApiResponse(response.code(), response.headers(), responseBody == null ? "" : responseBody.string());
    }
  }

}
