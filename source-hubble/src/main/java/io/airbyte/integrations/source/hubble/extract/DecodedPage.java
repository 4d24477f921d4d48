/*
 * Copyright (c) 2020-2025 Airbyte, Inc., all rights reserved.
 */

package io.airbyte.integrations.source.hubble.extract;

import com.fasterxml.jackson.databind.JsonNode;
import java.util.List;

/**
 * Records of one successful page, after sanitization and decoding.
 *
 * @param records the {@code data} array, in response order
 * @param nullSequencesRemoved null escapes and characters stripped from the raw body
 */
public record DecodedPage(List<JsonNode> records, int nullSequencesRemoved) {

  public DecodedPage {
    records = List.copyOf(records);
  }

  public int size() {
    return records.size();
  }

}
