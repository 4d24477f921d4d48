/*
 * Copyright (c) 2020-2025 Airbyte, Inc., all rights reserved.
 */

package io.airbyte.integrations.source.hubble.protocol;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.airbyte.integrations.source.hubble.exception.FailureType;
import io.airbyte.integrations.source.hubble.json.Jsons;
import java.time.Instant;
import java.util.Objects;
import org.apache.commons.lang3.exception.ExceptionUtils;

/**
 * One line of connector output. The payload is stored as JSON and nested under the key named by
 * the {@link MessageType}, e.g. {@code {"type":"RECORD","record":{...}}}.
 */
public final class ConnectorMessage {

  private final MessageType type;
  private final JsonNode payload;

  private ConnectorMessage(final MessageType type, final JsonNode payload) {
    this.type = Objects.requireNonNull(type);
    this.payload = Objects.requireNonNull(payload);
  }

  public static ConnectorMessage record(final String stream, final JsonNode data, final Instant emittedAt) {
    final ObjectNode record = Jsons.emptyObject();
    record.put("stream", stream);
    record.set("data", data);
    record.put("emitted_at", emittedAt.toEpochMilli());
    return new ConnectorMessage(MessageType.RECORD, record);
  }

  /**
   * Per-stream state message. {@code streamState} is what the host hands back on the next run.
   */
  public static ConnectorMessage streamState(final String stream, final JsonNode streamState) {
    final ObjectNode descriptor = Jsons.emptyObject();
    descriptor.set("stream_descriptor", Jsons.emptyObject().put("name", stream));
    descriptor.set("stream_state", streamState);
    final ObjectNode state = Jsons.emptyObject();
    state.put("type", "STREAM");
    state.set("stream", descriptor);
    return new ConnectorMessage(MessageType.STATE, state);
  }

  public static ConnectorMessage log(final String level, final String message) {
    final ObjectNode log = Jsons.emptyObject();
    log.put("level", level);
    log.put("message", message);
    return new ConnectorMessage(MessageType.LOG, log);
  }

  /**
   * Error trace for a failure, optionally scoped to one stream.
   */
  public static ConnectorMessage error(final String stream,
                                       final String message,
                                       final Throwable cause,
                                       final FailureType failureType,
                                       final Instant emittedAt) {
    final ObjectNode error = Jsons.emptyObject();
    error.put("message", message);
    if (cause != null) {
      error.put("internal_message", cause.toString());
      error.put("stack_trace", ExceptionUtils.getStackTrace(cause));
    }
    error.put("failure_type", failureType.value());
    if (stream != null) {
      error.set("stream_descriptor", Jsons.emptyObject().put("name", stream));
    }
    final ObjectNode trace = Jsons.emptyObject();
    trace.put("type", "ERROR");
    trace.put("emitted_at", (double) emittedAt.toEpochMilli());
    trace.set("error", error);
    return new ConnectorMessage(MessageType.TRACE, trace);
  }

  public static ConnectorMessage spec(final JsonNode specification) {
    return new ConnectorMessage(MessageType.SPEC, specification);
  }

  public static ConnectorMessage catalog(final JsonNode catalog) {
    return new ConnectorMessage(MessageType.CATALOG, catalog);
  }

  public static ConnectorMessage connectionStatus(final boolean succeeded, final String message) {
    final ObjectNode status = Jsons.emptyObject();
    status.put("status", succeeded ? "SUCCEEDED" : "FAILED");
    if (message != null) {
      status.put("message", message);
    }
    return new ConnectorMessage(MessageType.CONNECTION_STATUS, status);
  }

  public MessageType getType() {
    return type;
  }

  public JsonNode getPayload() {
    return payload;
  }

  public JsonNode toJson() {
    final ObjectNode json = Jsons.emptyObject();
    json.put("type", type.name());
    json.set(type.getPayloadField(), payload);
    return json;
  }

  public String serialize() {
    return Jsons.serialize(toJson());
  }

  @Override
  public String toString() {
    return serialize();
  }

}
