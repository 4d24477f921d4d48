/*
 * Copyright (c) 2020-2025 Airbyte, Inc., all rights reserved.
 */

package io.airbyte.integrations.source.hubble.sanitize;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

class ResponseSanitizerTest {

  private static final String ESCAPE = "\\" + "u0000";

  @Test
  void testRemovesEscapedNull() {
    final SanitizedText result = ResponseSanitizer.sanitize("{\"name\":\"a" + ESCAPE + "b\"}");

    assertEquals("{\"name\":\"ab\"}", result.text());
    assertEquals(1, result.removed());
    assertTrue(result.changed());
  }

  @Test
  void testRemovesRawNullCharacters() {
    final SanitizedText result = ResponseSanitizer.sanitize("a\0b\0c");

    assertEquals("abc", result.text());
    assertEquals(2, result.removed());
  }

  @Test
  void testRemovesBothForms() {
    final SanitizedText result = ResponseSanitizer.sanitize(ESCAPE + "x\0" + ESCAPE);

    assertEquals("x", result.text());
    assertEquals(3, result.removed());
  }

  @Test
  void testSequenceRevealedByRemovalIsAlsoRemoved() {
    // dropping the raw null in the middle joins the two halves into a new escape
    final SanitizedText result = ResponseSanitizer.sanitize("\\u00" + "\0" + "00");

    assertEquals("", result.text());
    assertEquals(2, result.removed());
  }

  @Test
  void testCleanTextIsUnchanged() {
    final String clean = "{\"data\":[{\"_id\":\"1\",\"note\":\"\\u00e9t\\u00e9\"}]}";

    final SanitizedText result = ResponseSanitizer.sanitize(clean);

    assertEquals(clean, result.text());
    assertEquals(0, result.removed());
    assertFalse(result.changed());
  }

  @Test
  void testNullInputBecomesEmptyText() {
    final SanitizedText result = ResponseSanitizer.sanitize(null);

    assertEquals("", result.text());
    assertEquals(0, result.removed());
  }

  @ParameterizedTest
  @ValueSource(strings = {"", "plain", "a\0b", "x\\u0000y", "\\u0000\\u0000\0", "\\u\\u00000000"})
  void testSanitizingTwiceChangesNothing(final String input) {
    final SanitizedText once = ResponseSanitizer.sanitize(input);
    final SanitizedText twice = ResponseSanitizer.sanitize(once.text());

    assertEquals(once.text(), twice.text());
    assertEquals(0, twice.removed());
    assertFalse(twice.text().contains(ESCAPE));
    assertFalse(twice.text().contains("\0"));
  }

}
