package com.onthegomap.overlapresolver.reader;

import com.onthegomap.overlapresolver.util.CloseableIterator;

/**
 * A layer of polygon features supplied by the host application.
 * <p>
 * Implementations may read from any storage, the resolver only iterates each source once.
 */
public interface FeatureSource {

  /** Returns the identifier of this layer, unique across the input. */
  String layerId();

  /** Returns an iterator over every feature in the layer that the caller must close. */
  CloseableIterator<InputFeature> features();
}
