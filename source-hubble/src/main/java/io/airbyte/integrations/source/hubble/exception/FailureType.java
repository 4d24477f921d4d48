/*
 * Copyright (c) 2020-2025 Airbyte, Inc., all rights reserved.
 */

package io.airbyte.integrations.source.hubble.exception;

/**
 * Classification attached to every connector failure. It ends up in the error trace message so
 * the platform can tell a user mistake from an upstream outage.
 */
public enum FailureType {

  CONFIG_ERROR("config_error"),
  TRANSIENT_ERROR("transient_error"),
  SYSTEM_ERROR("system_error");

  private final String value;

  FailureType(final String value) {
    this.value = value;
  }

  public String value() {
    return value;
  }

}
