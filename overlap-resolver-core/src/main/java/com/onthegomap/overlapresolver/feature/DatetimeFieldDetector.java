package com.onthegomap.overlapresolver.feature;

import com.onthegomap.overlapresolver.reader.WithAttributes;
import com.onthegomap.overlapresolver.util.Parse;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Guesses which attribute of a layer holds the survey date when none is configured.
 * <p>
 * Fields with a date-like name are tried first, then the rest in declaration order. A field qualifies when more than
 * 70% of its first 10 non-null values parse as a date or time.
 */
public class DatetimeFieldDetector {

  private static final Logger LOGGER = LoggerFactory.getLogger(DatetimeFieldDetector.class);
  private static final List<String> KEYWORDS = List.of("date", "time", "dt", "datetime", "survey", "gps", "epoch");
  static final int SAMPLE_SIZE = 10;
  static final double MIN_MATCH_RATIO = 0.7;

  private DatetimeFieldDetector() {}

  /** Returns true if {@code field} has a name that suggests it holds a date or time. */
  public static boolean looksLikeDatetime(String field) {
    String lower = field.toLowerCase(Locale.ROOT);
    for (String keyword : KEYWORDS) {
      if (lower.contains(keyword)) {
        return true;
      }
    }
    return false;
  }

  /**
   * Returns the first of {@code fields} whose values in {@code features} look like dates, or empty if there is none.
   */
  public static Optional<String> detect(String layerId, Collection<String> fields,
    List<? extends WithAttributes> features) {
    List<String> candidates = new ArrayList<>(fields.size());
    fields.stream().filter(DatetimeFieldDetector::looksLikeDatetime).forEach(candidates::add);
    fields.stream().filter(field -> !looksLikeDatetime(field)).forEach(candidates::add);
    for (String field : candidates) {
      if (hasDatetimeValues(layerId, field, features)) {
        return Optional.of(field);
      }
    }
    return Optional.empty();
  }

  private static boolean hasDatetimeValues(String layerId, String field, List<? extends WithAttributes> features) {
    int sampled = 0;
    int valid = 0;
    for (var feature : features) {
      Object value = feature.getAttribute(field);
      if (value != null) {
        sampled++;
        if (Parse.isTimestamp(value)) {
          valid++;
        }
        if (sampled >= SAMPLE_SIZE) {
          break;
        }
      }
    }
    if (sampled > 0 && valid > MIN_MATCH_RATIO * sampled) {
      LOGGER.debug("Detected datetime field '{}' for layer '{}' with {}/{} matches", field, layerId, valid, sampled);
      return true;
    }
    return false;
  }
}
