/*
 * Copyright (c) 2020-2025 Airbyte, Inc., all rights reserved.
 */

package io.airbyte.integrations.source.hubble.extract;

/**
 * Terminal state of an {@link ExtractionLoop}.
 */
public enum ExtractionStatus {
  SUCCEEDED,
  FAILED,
  CANCELLED
}
