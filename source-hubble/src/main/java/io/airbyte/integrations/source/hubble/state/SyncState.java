/*
 * Copyright (c) 2020-2025 Airbyte, Inc., all rights reserved.
 */

package io.airbyte.integrations.source.hubble.state;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.airbyte.integrations.source.hubble.json.Jsons;
import java.time.OffsetDateTime;
import java.time.format.DateTimeParseException;
import java.util.Optional;
import org.apache.commons.lang3.StringUtils;

/**
 * Incremental checkpoint of one stream: the highest {@code updatedAt} seen so far. Values are
 * immutable and only ever move forward.
 *
 * @param highWaterMark ISO-8601 timestamp as received from the API, empty before the first sync
 *        without a start date
 */
public record SyncState(Optional<String> highWaterMark) {

  public static final String CURSOR_FIELD = "updatedAt";

  private static final SyncState EMPTY = new SyncState(Optional.empty());

  public SyncState {
    highWaterMark = highWaterMark.filter(StringUtils::isNotBlank);
  }

  public static SyncState empty() {
    return EMPTY;
  }

  public static SyncState of(final String highWaterMark) {
    return new SyncState(Optional.ofNullable(highWaterMark));
  }

  /**
   * Restore the state handed over by the host. A missing or empty state starts from
   * {@code startDate} when one is configured.
   *
   * @param streamState {@code {"updatedAt": "..."}} or null
   * @param startDate configured start date
   * @return initial state of the invocation
   */
  public static SyncState restore(final JsonNode streamState, final Optional<String> startDate) {
    if (streamState != null && streamState.hasNonNull(CURSOR_FIELD) && !streamState.get(CURSOR_FIELD).asText().isBlank()) {
      return of(streamState.get(CURSOR_FIELD).asText());
    }
    return new SyncState(startDate);
  }

  /**
   * Move the high-water mark to {@code candidate} when it is later than the current one.
   *
   * @param candidate {@code updatedAt} of an emitted record, may be null
   * @return this state or a newer one, never an older one
   */
  public SyncState advance(final String candidate) {
    if (StringUtils.isBlank(candidate)) {
      return this;
    }
    if (highWaterMark.isEmpty() || compare(candidate, highWaterMark.get()) > 0) {
      return of(candidate);
    }
    return this;
  }

  public SyncState advance(final JsonNode record) {
    final JsonNode value = record == null ? null : record.get(CURSOR_FIELD);
    return value != null && value.isTextual() ? advance(value.asText()) : this;
  }

  public JsonNode toJson() {
    final ObjectNode json = Jsons.emptyObject();
    highWaterMark.ifPresent(mark -> json.put(CURSOR_FIELD, mark));
    return json;
  }

  /**
   * Compare as instants when both sides parse, otherwise as plain strings. ISO-8601 strings in the
   * same zone and precision sort the same either way.
   */
  static int compare(final String left, final String right) {
    final Optional<OffsetDateTime> leftTime = parse(left);
    final Optional<OffsetDateTime> rightTime = parse(right);
    if (leftTime.isPresent() && rightTime.isPresent()) {
      return leftTime.get().toInstant().compareTo(rightTime.get().toInstant());
    }
    return left.compareTo(right);
  }

  private static Optional<OffsetDateTime> parse(final String value) {
    try {
      return Optional.of(OffsetDateTime.parse(value));
    } catch (final DateTimeParseException e) {
      return Optional.empty();
    }
  }

}
