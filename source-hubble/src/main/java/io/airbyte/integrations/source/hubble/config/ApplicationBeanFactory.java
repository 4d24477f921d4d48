/*
 * Copyright (c) 2020-2025 Airbyte, Inc., all rights reserved.
 */

package io.airbyte.integrations.source.hubble.config;

import com.google.common.net.HttpHeaders;
import dev.failsafe.spi.Scheduler;
import io.micronaut.context.annotation.Factory;
import io.micronaut.context.annotation.Value;
import jakarta.inject.Singleton;
import java.time.Clock;
import java.time.Duration;
import okhttp3.OkHttpClient;

/**
 * Defines the instantiation of the shared infrastructure beans.
 */
@Factory
public class ApplicationBeanFactory {

  /**
   * Application-wide HTTP client. Per-configuration clients (token, request timeout) are derived
   * from it so that they share the connection pool.
   */
  @Singleton
  public OkHttpClient okHttpClient(@Value("${airbyte.hubble.http.connect-timeout:10s}") final Duration connectTimeout,
                                   @Value("${airbyte.hubble.http.user-agent:airbyte-source-hubble}") final String userAgent) {
    return new OkHttpClient.Builder()
        .connectTimeout(connectTimeout)
        .retryOnConnectionFailure(false)
        .addInterceptor(chain -> chain.proceed(chain.request().newBuilder().header(HttpHeaders.USER_AGENT, userAgent).build()))
        .build();
  }

  @Singleton
  public Clock clock() {
    return Clock.systemUTC();
  }

  /**
   * Scheduler used by Failsafe for retry waits.
   */
  @Singleton
  public Scheduler failsafeScheduler() {
    return Scheduler.DEFAULT;
  }

}
