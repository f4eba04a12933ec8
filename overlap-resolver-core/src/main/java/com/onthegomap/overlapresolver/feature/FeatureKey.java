package com.onthegomap.overlapresolver.feature;

import java.util.Objects;

/**
 * The global identity of a feature: the layer it came from and its id within that layer.
 * <p>
 * Keys sort by layer id then by the string form of the feature id, both lexicographically, which makes every tie-break
 * between features reproducible regardless of input order.
 *
 * @param sourceLayer id of the layer the feature came from
 * @param id          string form of the feature id
 */
public record FeatureKey(String sourceLayer, String id) implements Comparable<FeatureKey> {

  public FeatureKey {
    Objects.requireNonNull(sourceLayer, "sourceLayer");
    Objects.requireNonNull(id, "id");
  }

  /** Returns the key of the feature with {@code id} in {@code sourceLayer}, using the string form of the id. */
  public static FeatureKey of(String sourceLayer, Object id) {
    return new FeatureKey(sourceLayer, String.valueOf(id));
  }

  @Override
  public int compareTo(FeatureKey o) {
    int result = sourceLayer.compareTo(o.sourceLayer);
    if (result == 0) {
      result = id.compareTo(o.id);
    }
    return result;
  }

  @Override
  public String toString() {
    return sourceLayer + ":" + id;
  }
}
