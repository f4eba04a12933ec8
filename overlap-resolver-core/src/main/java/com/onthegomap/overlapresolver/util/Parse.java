package com.onthegomap.overlapresolver.util;

import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.time.ZonedDateTime;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeFormatterBuilder;
import java.time.format.DateTimeParseException;
import java.time.format.ResolverStyle;
import java.time.temporal.TemporalAccessor;
import java.util.Date;
import java.util.List;
import java.util.Locale;
import org.apache.commons.lang3.StringUtils;

/**
 * Utilities to parse values from attribute values.
 */
public class Parse {

  /**
   * Date and date-time layouts found in survey attribute tables, tried in order after ISO-8601.
   * <p>
   * US month-first layouts come before European day-first ones so that ambiguous values like {@code 01/02/2024} parse
   * as January 2nd.
   */
  private static final List<String> DATETIME_PATTERNS = List.of(
    "uuuu-M-d H:m:s",
    "uuuu-M-d H:m",
    "uuuu-M-d",
    "uuuuMMddHHmmss",
    "uuuuMMddHHmm",

    "M-d-uuuu H:m:s",
    "M-d-uuuu H:m",
    "M-d-uuuu",
    "M/d/uuuu H:m:s",
    "M/d/uuuu H:m",
    "M/d/uuuu",

    "d-M-uuuu H:m:s",
    "d-M-uuuu H:m",
    "d-M-uuuu",
    "d/M/uuuu H:m:s",
    "d/M/uuuu H:m",
    "d/M/uuuu",

    "uuuuMMdd",
    "ddMMuuuu",
    "MMdduuuu",
    "uuuu-M-d'T'H:m:s",
    "uuuu-M-d'T'H:m",

    "d-MMM-uuuu H:m:s",
    "d-MMM-uuuu H:m",
    "d-MMM-uuuu",
    "MMM-d-uuuu H:m:s",
    "MMM-d-uuuu H:m",
    "MMM-d-uuuu",

    // GPS day-of-year
    "uuuu-D H:m:s",
    "uuuu-D H:m",
    "uuuu-D",

    "uuuu/M/d H:m:s",
    "uuuu/M/d H:m",
    "uuuu/M/d",
    "d.M.uuuu H:m:s",
    "d.M.uuuu H:m",
    "d.M.uuuu",

    "uuuu-M-d h:m:s a",
    "uuuu-M-d h:m a",
    "M/d/uuuu h:m:s a",
    "M/d/uuuu h:m a",
    "d/M/uuuu h:m:s a",
    "d/M/uuuu h:m a",

    "uuuu-M-d H:m:s 'UTC'",
    "uuuu-M-d H:m 'UTC'",
    "uuuu-M-d'T'H:m:s'Z'",
    "uuuu-M-d'T'H:m'Z'"
  );

  private static final List<DateTimeFormatter> DATETIME_FORMATTERS = DATETIME_PATTERNS.stream()
    .map(pattern -> new DateTimeFormatterBuilder()
      .parseCaseInsensitive()
      .appendPattern(pattern)
      .toFormatter(Locale.ENGLISH)
      .withResolverStyle(ResolverStyle.STRICT))
    .toList();

  private Parse() {}

  /**
   * Returns {@code value} as an instant in time or null if it is missing or cannot be parsed.
   * <p>
   * {@link java.time} values and {@link Date} are converted directly, anything else is parsed from its string form as
   * ISO-8601 and then each of the common survey layouts in {@link #DATETIME_PATTERNS}. Values without an offset are
   * treated as UTC.
   */
  public static Instant parseTimestampOrNull(Object value) {
    if (value == null) {
      return null;
    } else if (value instanceof Instant instant) {
      return instant;
    } else if (value instanceof OffsetDateTime offsetDateTime) {
      return offsetDateTime.toInstant();
    } else if (value instanceof ZonedDateTime zonedDateTime) {
      return zonedDateTime.toInstant();
    } else if (value instanceof LocalDateTime localDateTime) {
      return localDateTime.toInstant(ZoneOffset.UTC);
    } else if (value instanceof LocalDate localDate) {
      return localDate.atStartOfDay(ZoneOffset.UTC).toInstant();
    } else if (value instanceof Date date) {
      return date.toInstant();
    }
    String text = StringUtils.strip(value.toString());
    if (StringUtils.isEmpty(text)) {
      return null;
    }
    Instant iso = parseIsoOrNull(text);
    if (iso != null) {
      return iso;
    }
    for (DateTimeFormatter formatter : DATETIME_FORMATTERS) {
      Instant result = parseOrNull(formatter, text);
      if (result != null) {
        return result;
      }
    }
    return null;
  }

  /** Returns true if {@code value} can be parsed by {@link #parseTimestampOrNull(Object)}. */
  public static boolean isTimestamp(Object value) {
    return parseTimestampOrNull(value) != null;
  }

  private static Instant parseIsoOrNull(String text) {
    try {
      return toInstant(DateTimeFormatter.ISO_DATE_TIME.parseBest(text, ZonedDateTime::from, LocalDateTime::from));
    } catch (DateTimeParseException e) {
      return parseOrNull(DateTimeFormatter.ISO_LOCAL_DATE, text);
    }
  }

  private static Instant parseOrNull(DateTimeFormatter formatter, String text) {
    try {
      return toInstant(formatter.parseBest(text, LocalDateTime::from, LocalDate::from));
    } catch (DateTimeParseException e) {
      return null;
    }
  }

  private static Instant toInstant(TemporalAccessor parsed) {
    if (parsed instanceof ZonedDateTime zoned) {
      return zoned.toInstant();
    } else if (parsed instanceof LocalDateTime local) {
      return local.toInstant(ZoneOffset.UTC);
    } else if (parsed instanceof LocalDate date) {
      return date.atStartOfDay(ZoneOffset.UTC).toInstant();
    }
    return Instant.from(parsed);
  }
}
