package com.robomania.utils;

import java.time.Instant;
import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.ZoneId;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.time.temporal.TemporalAccessor;
import java.util.Optional;

/** Parses the ISO-8601 timestamps sent by the Roboweb panel. */
public final class Timestamps {

  private Timestamps() {}

  /**
   * Parses {@code value} as an instant. Values without an offset are read as local time in {@code
   * zone}.
   *
   * @throws IllegalArgumentException when the value is blank or not ISO-8601
   */
  public static Instant parse(final String value, final ZoneId zone) {
    if (value == null || value.isBlank()) {
      throw new IllegalArgumentException("Timestamp is missing");
    }

    try {
      final TemporalAccessor parsed =
          DateTimeFormatter.ISO_DATE_TIME.parseBest(
              value.trim(), OffsetDateTime::from, LocalDateTime::from);
      if (parsed instanceof OffsetDateTime offsetDateTime) {
        return offsetDateTime.toInstant();
      }
      return ((LocalDateTime) parsed).atZone(zone).toInstant();
    } catch (final DateTimeParseException e) {
      throw new IllegalArgumentException("Invalid ISO-8601 timestamp: " + value, e);
    }
  }

  public static Optional<Instant> parseOptional(final String value, final ZoneId zone) {
    if (value == null || value.isBlank()) {
      return Optional.empty();
    }
    return Optional.of(parse(value, zone));
  }
}
