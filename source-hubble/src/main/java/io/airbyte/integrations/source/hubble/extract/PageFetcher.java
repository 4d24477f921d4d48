/*
 * Copyright (c) 2020-2025 Airbyte, Inc., all rights reserved.
 */

package io.airbyte.integrations.source.hubble.extract;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.airbyte.integrations.source.hubble.config.StreamSpec;
import io.airbyte.integrations.source.hubble.exception.MalformedResponseException;
import io.airbyte.integrations.source.hubble.http.ApiResponse;
import io.airbyte.integrations.source.hubble.http.PageRequester;
import io.airbyte.integrations.source.hubble.json.Jsons;
import io.airbyte.integrations.source.hubble.sanitize.ResponseSanitizer;
import io.airbyte.integrations.source.hubble.sanitize.SanitizedText;
import java.util.ArrayList;
import java.util.List;
import lombok.extern.slf4j.Slf4j;

/**
 * Request, sanitize and decode one page. Expects {@code {"data": [...], "meta": {...}}}; only
 * {@code data} is read.
 */
@Slf4j
public class PageFetcher {

  static final String DATA_FIELD = "data";

  private final PageRequester requester;

  public PageFetcher(final PageRequester requester) {
    this.requester = requester;
  }

  /**
   * @param stream target of the request
   * @param body query body, resent unchanged on retries
   * @return decoded records of the page
   * @throws InterruptedException when interrupted during a retry wait
   */
  public DecodedPage fetch(final StreamSpec stream, final ObjectNode body) throws InterruptedException {
    final ApiResponse response = requester.execute(stream.name(), stream.endpointUrl(), body);
    final SanitizedText sanitized = ResponseSanitizer.sanitize(response.body());
    if (sanitized.changed()) {
      log.warn("Stream {}: removed {} null sequence(s) from the response.", stream.name(), sanitized.removed());
    }
    return new DecodedPage(decode(stream.name(), sanitized.text()), sanitized.removed());
  }

  static List<JsonNode> decode(final String stream, final String text) {
    final JsonNode document;
    try {
      document = Jsons.parse(text);
    } catch (final JsonProcessingException e) {
      throw new MalformedResponseException(
          String.format("Stream %s: response is not valid JSON: %s", stream, e.getOriginalMessage()), e);
    }
    if (document == null || !document.isObject()) {
      throw new MalformedResponseException(String.format("Stream %s: expected a JSON object, got %s", stream,
          document == null || document.isMissingNode() ? "an empty body" : document.getNodeType()));
    }

    final JsonNode data = document.get(DATA_FIELD);
    if (data == null || data.isNull()) {
      log.warn("Stream {}: response has no '{}' field, treating it as an empty page.", stream, DATA_FIELD);
      return List.of();
    }
    if (!data.isArray()) {
      throw new MalformedResponseException(
          String.format("Stream %s: '%s' must be an array, got %s", stream, DATA_FIELD, data.getNodeType()));
    }

    final List<JsonNode> records = new ArrayList<>(data.size());
    for (final JsonNode record : data) {
      if (!record.isObject()) {
        throw new MalformedResponseException(
            String.format("Stream %s: record %d is a %s, not an object", stream, records.size(), record.getNodeType()));
      }
      records.add(record);
    }
    return records;
  }

}
