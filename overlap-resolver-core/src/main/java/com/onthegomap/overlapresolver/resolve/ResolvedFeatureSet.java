package com.onthegomap.overlapresolver.resolve;

import com.onthegomap.overlapresolver.feature.AttributeSchema;
import com.onthegomap.overlapresolver.writer.FeatureSink;
import java.util.List;
import java.util.function.Predicate;

/**
 * The non-overlapping output of a resolution run, ordered by the position of each input feature then fragment.
 *
 * @param schema   output attribute fields
 * @param features the resolved features
 */
public record ResolvedFeatureSet(AttributeSchema schema, List<ResolvedFeature> features) {

  public ResolvedFeatureSet {
    features = List.copyOf(features);
  }

  public static ResolvedFeatureSet empty(AttributeSchema schema) {
    return new ResolvedFeatureSet(schema, List.of());
  }

  public int size() {
    return features.size();
  }

  public boolean isEmpty() {
    return features.isEmpty();
  }

  /** Returns the output features that match {@code filter}. */
  public List<ResolvedFeature> filter(Predicate<ResolvedFeature> filter) {
    return features.stream().filter(filter).toList();
  }

  /** Returns the output features with {@code status}. */
  public List<ResolvedFeature> withStatus(ResolvedFeature.Status status) {
    return filter(feature -> feature.status() == status);
  }

  /** Passes the schema then every feature in order to {@code sink}. */
  public void writeTo(FeatureSink sink) {
    sink.start(schema);
    for (ResolvedFeature feature : features) {
      sink.write(feature);
    }
    sink.finish();
  }
}
