package com.riskengine.sim.store;

import com.fasterxml.jackson.databind.JsonNode;

import java.time.Instant;
import java.time.OffsetDateTime;
import java.time.format.DateTimeParseException;

/**
 * Parses {@code timestamptz} values as PostgREST renders them, e.g. {@code 2024-01-15T10:00:00+00:00} or
 * {@code 2024-01-15 10:00:00+00}.
 */
final class StoreTimestamps {

  private StoreTimestamps() {
  }

  /**
   * Null for missing, null, blank or unparseable values.
   */
  static Instant parse(JsonNode node) {
    if (node == null || node.isMissingNode() || node.isNull()) {
      return null;
    }
    String text = node.asText().trim();
    if (text.isEmpty()) {
      return null;
    }
    String iso = text.replace(' ', 'T');
    if (iso.matches(".*[+-]\\d{2}$")) {
      iso = iso + ":00";
    }
    try {
      return OffsetDateTime.parse(iso).toInstant();
    } catch (DateTimeParseException e) {
      try {
        return Instant.parse(iso);
      } catch (DateTimeParseException ignored) {
        return null;
      }
    }
  }
}
