package com.onthegomap.overlapresolver.resolve;

import com.onthegomap.overlapresolver.feature.Feature;
import com.onthegomap.overlapresolver.feature.FeatureKey;
import java.util.List;
import org.locationtech.jts.geom.Geometry;

/**
 * A group member that did not win the group, with what is left of its geometry.
 *
 * @param feature   the original feature
 * @param geometry  the part of the feature not covered by a higher-ranked member it overlaps, empty if it was fully
 *                  covered
 * @param trimmedBy keys of the higher-ranked members that were cut out of it, empty if it outranks every member it
 *                  overlaps
 */
public record TrimmedFeature(Feature feature, Geometry geometry, List<FeatureKey> trimmedBy) {

  public TrimmedFeature {
    trimmedBy = List.copyOf(trimmedBy);
  }

  public FeatureKey key() {
    return feature.key();
  }

  /** Returns true if higher-ranked members covered this whole feature, so nothing is left to output. */
  public boolean isSubsumed() {
    return geometry.isEmpty();
  }

  /**
   * Returns true if this feature outranks every member it overlaps, so it wins its own part of the group and keeps its
   * geometry.
   */
  public boolean isUntouched() {
    return trimmedBy.isEmpty();
  }
}
