package com.onthegomap.overlapresolver.feature;

import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;

/**
 * The attribute fields of the resolved output: every input field in first-seen order followed by the attribute that
 * holds the source layer id.
 * <p>
 * An input field with the same name as the source layer attribute is replaced by it.
 */
public record AttributeSchema(List<String> inputFields, String sourceLayerAttribute) {

  public AttributeSchema {
    inputFields = List.copyOf(inputFields);
  }

  /** Returns the schema covering the union of {@code fields}, which may contain duplicates. */
  public static AttributeSchema union(Collection<String> fields, String sourceLayerAttribute) {
    var result = new LinkedHashSet<>(fields);
    result.remove(sourceLayerAttribute);
    return new AttributeSchema(new ArrayList<>(result), sourceLayerAttribute);
  }

  /** Returns every output field name, source layer attribute last. */
  public List<String> fieldNames() {
    List<String> result = new ArrayList<>(inputFields.size() + 1);
    result.addAll(inputFields);
    result.add(sourceLayerAttribute);
    return result;
  }

  /**
   * Returns {@code attributes} reordered to this schema with null for missing fields and the source layer attribute
   * set to {@code sourceLayer}.
   */
  public Map<String, Object> project(Map<String, Object> attributes, String sourceLayer) {
    Map<String, Object> result = new LinkedHashMap<>(inputFields.size() * 2);
    for (String field : inputFields) {
      result.put(field, attributes.get(field));
    }
    result.put(sourceLayerAttribute, sourceLayer);
    return result;
  }
}
