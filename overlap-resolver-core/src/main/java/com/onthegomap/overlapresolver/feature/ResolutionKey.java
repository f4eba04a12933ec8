package com.onthegomap.overlapresolver.feature;

import java.time.Instant;

/** The value used to rank a feature against the other members of its overlap group. */
public sealed interface ResolutionKey {

  /** Returns true if this feature can win an overlap group. */
  default boolean isRanked() {
    return !(this instanceof Unranked);
  }

  /** Datetime mode: the newest survey time wins. */
  record Timestamp(Instant time) implements ResolutionKey {}

  /** Priority mode: the lowest rank wins. */
  record Priority(int rank) implements ResolutionKey {}

  /** Datetime mode: a feature with a missing or unparseable time that can only ever lose. */
  record Unranked(String reason) implements ResolutionKey {}
}
