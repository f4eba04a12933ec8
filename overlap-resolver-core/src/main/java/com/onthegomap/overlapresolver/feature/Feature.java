package com.onthegomap.overlapresolver.feature;

import com.onthegomap.overlapresolver.reader.WithAttributes;
import java.util.Map;
import org.locationtech.jts.geom.Envelope;
import org.locationtech.jts.geom.Geometry;

/**
 * A loaded input feature with a valid geometry and the key used to rank it.
 * <p>
 * Entries are never modified after they are loaded, geometries trimmed during resolution live in the results instead.
 *
 * @param index         position in the store: layers in input order, then features in layer order
 * @param key           global identity of the feature
 * @param geometry      valid polygon or multipolygon, the input instance when it was already valid
 * @param attributes    immutable input attributes
 * @param resolutionKey timestamp, priority or the reason this feature is unranked
 */
public record Feature(
  int index,
  FeatureKey key,
  Geometry geometry,
  Map<String, Object> attributes,
  ResolutionKey resolutionKey
) implements WithAttributes {

  public String sourceLayer() {
    return key.sourceLayer();
  }

  public Envelope envelope() {
    return geometry.getEnvelopeInternal();
  }

  @Override
  public String toString() {
    return "Feature{" + key + " index=" + index + " " + resolutionKey + "}";
  }
}
