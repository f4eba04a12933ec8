package com.onthegomap.overlapresolver.writer;

import com.onthegomap.overlapresolver.feature.AttributeSchema;
import com.onthegomap.overlapresolver.resolve.ResolvedFeature;
import java.util.List;

/** Consumer of resolved features that the host application writes to its output format. */
@FunctionalInterface
public interface FeatureSink {

  /** Returns a sink that appends every feature to {@code list}. */
  static FeatureSink collect(List<ResolvedFeature> list) {
    return list::add;
  }

  /** Called once with the output schema before any feature is written. */
  default void start(AttributeSchema schema) {}

  void write(ResolvedFeature feature);

  /** Called once after the last feature is written. */
  default void finish() {}
}
