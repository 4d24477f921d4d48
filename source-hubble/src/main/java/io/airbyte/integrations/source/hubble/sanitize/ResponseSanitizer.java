/*
 * Copyright (c) 2020-2025 Airbyte, Inc., all rights reserved.
 */

package io.airbyte.integrations.source.hubble.sanitize;

import org.apache.commons.lang3.StringUtils;

/**
 * Strips the null code point from raw response text before it reaches the JSON decoder. The
 * upstream API sometimes embeds it in string values, either as the six-character JSON escape
 * (backslash, {@code u0000}) or as a literal NUL character, and both make downstream decoding or
 * writing fail.
 * <p>
 * Removal is repeated until nothing is left to remove, so that fragments joined by a removal
 * are caught as well and a second pass is always a no-op. No other
 * character is touched.
 */
public final class ResponseSanitizer {

  static final String NULL_ESCAPE = "\\u0000";
  static final String NULL_CHAR = "\0";

  private ResponseSanitizer() {}

  /**
   * Remove every null escape and null character.
   *
   * @param rawText response body as received, may be null
   * @return cleaned text and the number of removed occurrences
   */
  public static SanitizedText sanitize(final String rawText) {
    if (rawText == null || rawText.isEmpty()) {
      return new SanitizedText(rawText == null ? "" : rawText, 0);
    }
    String text = rawText;
    int removed = 0;
    while (true) {
      final int escapes = StringUtils.countMatches(text, NULL_ESCAPE);
      final int chars = StringUtils.countMatches(text, NULL_CHAR);
      if (escapes == 0 && chars == 0) {
        return new SanitizedText(text, removed);
      }
      text = StringUtils.remove(StringUtils.remove(text, NULL_ESCAPE), NULL_CHAR);
      removed += escapes + chars;
    }
  }

}
