/*
 * Copyright (c) 2020-2025 Airbyte, Inc., all rights reserved.
 */

package io.airbyte.integrations.source.hubble.sanitize;

/**
 * Result of {@link ResponseSanitizer#sanitize(String)}.
 *
 * @param text the cleaned text
 * @param removed how many null escapes and null characters were dropped
 */
public record SanitizedText(String text, int removed) {

  public boolean changed() {
    return removed > 0;
  }

}
