package com.onthegomap.overlapresolver.reader;

import com.onthegomap.overlapresolver.util.CloseableIterator;
import java.util.List;

/** An in-memory {@link FeatureSource} backed by a list of features. */
public record InputLayer(String layerId, List<InputFeature> featureList) implements FeatureSource {

  public InputLayer {
    featureList = List.copyOf(featureList);
  }

  public static InputLayer of(String layerId, InputFeature... features) {
    return new InputLayer(layerId, List.of(features));
  }

  @Override
  public CloseableIterator<InputFeature> features() {
    return CloseableIterator.of(featureList);
  }
}
