/*
 * Copyright (c) 2020-2025 Airbyte, Inc., all rights reserved.
 */

package io.airbyte.integrations.source.hubble.config;

import io.airbyte.integrations.source.hubble.exception.HubbleConfigurationException;
import java.net.URI;
import java.net.URISyntaxException;
import java.util.regex.Pattern;
import okhttp3.HttpUrl;

/**
 * One extraction target: a stream name and the dataset endpoint it is read from. Configuration
 * input goes through {@link #of(String, String)}, which validates both; the canonical constructor
 * trusts its arguments.
 *
 * @param name lower-case identifier, starts with a letter
 * @param endpointUrl HTTPS endpoint of the dataset
 */
public record StreamSpec(String name, HttpUrl endpointUrl) {

  static final int MAX_NAME_LENGTH = 64;
  private static final Pattern STREAM_NAME = Pattern.compile("^[a-z][a-z0-9_]*$");
  private static final String FORBIDDEN_URL_CHARACTERS = "<>\"{}|\\^`";

  public static StreamSpec of(final String name, final String endpointUrl) {
    validateStreamName(name);
    return new StreamSpec(name, validateEndpointUrl(endpointUrl));
  }

  /**
   * Scheme, host and port, e.g. {@code https://hub.data2apis.com/}.
   */
  public String baseUrl() {
    return endpointUrl.newBuilder().encodedPath("/").query(null).fragment(null).build().toString();
  }

  /**
   * Path relative to {@link #baseUrl()}, e.g. {@code dataset/all-hub-vacancies}.
   */
  public String path() {
    return endpointUrl.encodedPath().substring(1);
  }

  public static void validateStreamName(final String name) {
    if (name == null || name.isBlank()) {
      throw new HubbleConfigurationException("Stream name is empty");
    }
    if (name.length() > MAX_NAME_LENGTH) {
      throw new HubbleConfigurationException(
          String.format("Stream name '%s' is invalid: longer than %d characters", name, MAX_NAME_LENGTH));
    }
    if (!STREAM_NAME.matcher(name).matches()) {
      throw new HubbleConfigurationException(String.format(
          "Stream name '%s' is invalid: use lower-case letters, digits and underscores, starting with a letter", name));
    }
  }

  public static HttpUrl validateEndpointUrl(final String url) {
    if (url == null || url.isBlank()) {
      throw new HubbleConfigurationException("Endpoint URL is empty");
    }
    for (final char c : url.toCharArray()) {
      if (Character.isWhitespace(c) || Character.isISOControl(c) || FORBIDDEN_URL_CHARACTERS.indexOf(c) >= 0) {
        throw new HubbleConfigurationException(String.format("Endpoint URL '%s' contains an invalid character: '%s'", url, c));
      }
    }
    final URI uri;
    try {
      uri = new URI(url);
    } catch (final URISyntaxException e) {
      throw new HubbleConfigurationException(String.format("Endpoint URL '%s' is malformed", url), e);
    }
    if (!"https".equalsIgnoreCase(uri.getScheme())) {
      throw new HubbleConfigurationException(String.format("Endpoint URL '%s' must use HTTPS", url));
    }
    if (uri.getHost() == null || uri.getHost().isBlank()) {
      throw new HubbleConfigurationException(String.format("Endpoint URL '%s' has no domain", url));
    }
    final HttpUrl parsed = HttpUrl.parse(url);
    if (parsed == null) {
      throw new HubbleConfigurationException(String.format("Endpoint URL '%s' is malformed", url));
    }
    return parsed;
  }

}
