/*
 * Copyright (c) 2020-2025 Airbyte, Inc., all rights reserved.
 */

package io.airbyte.integrations.source.hubble.protocol;

/**
 * Kinds of message written to the platform. The lower-case name is the JSON key that holds the
 * payload.
 */
public enum MessageType {

  RECORD("record"),
  STATE("state"),
  LOG("log"),
  TRACE("trace"),
  SPEC("spec"),
  CATALOG("catalog"),
  CONNECTION_STATUS("connectionStatus");

  private final String payloadField;

  MessageType(final String payloadField) {
    this.payloadField = payloadField;
  }

  public String getPayloadField() {
    return payloadField;
  }

}
