package com.onthegomap.overlapresolver.overlap;

import com.onthegomap.overlapresolver.feature.Feature;
import org.locationtech.jts.geom.Geometry;

/**
 * A pair of features whose interiors intersect.
 *
 * @param a      the feature that comes first in the store
 * @param b      the feature that comes second in the store
 * @param region the area covered by both
 */
public record Overlap(Feature a, Feature b, Geometry region) {

  /** Overlaps covering more than this share of a feature's area make that feature a subdivision of the other. */
  public static final double SUBDIVISION_RATIO = 0.95;

  public double area() {
    return region.getArea();
  }

  /** Returns true if this overlap covers nearly all of {@code feature}, meaning it was re-surveyed by the other. */
  public boolean isSubdivisionOf(Feature feature) {
    double featureArea = feature.geometry().getArea();
    return featureArea > 0 && area() > SUBDIVISION_RATIO * featureArea;
  }

  /** Returns true if this overlap covers nearly all of either feature. */
  public boolean isSubdivision() {
    return isSubdivisionOf(a) || isSubdivisionOf(b);
  }

  /** Returns the other feature in this pair. */
  public Feature other(Feature feature) {
    return feature.index() == a.index() ? b : a;
  }
}
