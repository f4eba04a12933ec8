package com.onthegomap.overlapresolver.reader;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import org.locationtech.jts.geom.Geometry;

/**
 * A polygon feature read from an input layer.
 *
 * @param id         identifier that is unique within the layer, a number or a (hexadecimal) string
 * @param geometry   polygon or multipolygon
 * @param attributes attribute values in the order the layer declares its fields, null values allowed
 */
public record InputFeature(Object id, Geometry geometry, Map<String, Object> attributes) implements WithAttributes {

  public InputFeature {
    // Map.copyOf rejects null values, which are legal attribute values
    attributes = attributes == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(attributes));
  }

  /** Returns a new feature with no attributes. */
  public static InputFeature of(Object id, Geometry geometry) {
    return new InputFeature(id, geometry, Map.of());
  }

  /** Returns a new feature with attributes from alternating key/value pairs in {@code attributes}. */
  public static InputFeature of(Object id, Geometry geometry, Object... attributes) {
    if (attributes.length % 2 != 0) {
      throw new IllegalArgumentException("Expected key/value pairs, got odd number of arguments");
    }
    Map<String, Object> map = new LinkedHashMap<>();
    for (int i = 0; i < attributes.length; i += 2) {
      map.put(attributes[i].toString(), attributes[i + 1]);
    }
    return new InputFeature(id, geometry, map);
  }
}
