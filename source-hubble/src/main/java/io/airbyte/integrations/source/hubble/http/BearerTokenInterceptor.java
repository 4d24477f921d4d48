/*
 * Copyright (c) 2020-2025 Airbyte, Inc., all rights reserved.
 */

package io.airbyte.integrations.source.hubble.http;

import com.google.common.net.HttpHeaders;
import java.io.IOException;
import okhttp3.Interceptor;
import okhttp3.Request;
import okhttp3.Response;
import org.jetbrains.annotations.NotNull;

/**
 * Adds the API token to every request going through the client.
 */
public class BearerTokenInterceptor implements Interceptor {

  private final String token;

  public BearerTokenInterceptor(final String token) {
    this.token = token;
  }

  @NotNull
  @Override
  public Response intercept(@NotNull final Chain chain) throws IOException {
    final Request request = chain.request()
        .newBuilder()
        .header(HttpHeaders.AUTHORIZATION, "Bearer " + token)
        .build();
    return chain.proceed(request);
  }

  @Override
  public String toString() {
    return "BearerTokenInterceptor{token=****}";
  }

}
