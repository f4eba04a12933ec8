package com.onthegomap.overlapresolver.reader;

import com.onthegomap.overlapresolver.util.Parse;
import java.time.Instant;
import java.util.Map;

/** An input element with a set of string key/object value attribute pairs. */
public interface WithAttributes {

  static WithAttributes from(Map<String, Object> attributes) {
    return () -> attributes;
  }

  /** The key/value pairs on this element, in the order the source declared them. */
  Map<String, Object> attributes();

  default Object getAttribute(String key) {
    return attributes().get(key);
  }

  /** Returns the value for {@code key} as a string, or null if missing. */
  default String getString(String key) {
    Object value = getAttribute(key);
    return value == null ? null : value.toString();
  }

  /**
   * Returns the value for {@code key} parsed as a point in time, or null if it is missing or not in a recognized date
   * format.
   */
  default Instant getTimestamp(String key) {
    return Parse.parseTimestampOrNull(getAttribute(key));
  }
}
