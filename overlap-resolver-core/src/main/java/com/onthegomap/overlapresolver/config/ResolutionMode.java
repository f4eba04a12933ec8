package com.onthegomap.overlapresolver.config;

import java.util.Locale;

/** How the most authoritative feature is picked among features that overlap each other. */
public enum ResolutionMode {
  /** The feature with the latest parsed timestamp wins. */
  DATETIME("datetime"),
  /** The feature from the layer listed first in the priority order wins. */
  PRIORITY("priority");

  private final String id;

  ResolutionMode(String id) {
    this.id = id;
  }

  public String id() {
    return id;
  }

  /**
   * Returns the mode named {@code id}, ignoring case.
   *
   * @throws ConfigurationException if {@code id} is not {@code datetime} or {@code priority}
   */
  public static ResolutionMode from(String id) {
    if (id != null) {
      for (ResolutionMode mode : values()) {
        if (mode.id.equals(id.strip().toLowerCase(Locale.ROOT))) {
          return mode;
        }
      }
    }
    throw new ConfigurationException("resolution_mode must be 'datetime' or 'priority', got: " + id);
  }
}
