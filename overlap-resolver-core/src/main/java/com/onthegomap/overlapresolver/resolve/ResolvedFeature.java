package com.onthegomap.overlapresolver.resolve;

import com.onthegomap.overlapresolver.feature.FeatureKey;
import com.onthegomap.overlapresolver.reader.WithAttributes;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import org.locationtech.jts.geom.Geometry;

/**
 * One feature of the resolved output.
 *
 * @param key        identity of the input feature this came from
 * @param geometry   output geometry, the input instance for unchanged features
 * @param attributes input attributes projected onto the output schema, including the source layer attribute
 * @param status     what resolution did to the input feature
 * @param fragment   0-based part number when a trimmed multipolygon is split into one feature per polygon, otherwise 0
 */
public record ResolvedFeature(FeatureKey key, Geometry geometry, Map<String, Object> attributes, Status status,
  int fragment) implements WithAttributes {

  public ResolvedFeature {
    attributes = Collections.unmodifiableMap(new LinkedHashMap<>(attributes));
  }

  public enum Status {
    /** The feature overlaps nothing. */
    UNCHANGED,
    /** The feature outranks every feature it overlaps and keeps its geometry. */
    WINNER,
    /** Part of the feature was covered by a higher-ranked feature and removed. */
    TRIMMED,
    /** The group of the feature could not be resolved so it keeps its original geometry. */
    UNRESOLVED
  }
}
