package com.onthegomap.overlapresolver.geo;

import java.util.ArrayList;
import java.util.List;
import javax.annotation.concurrent.ThreadSafe;
import org.locationtech.jts.geom.Envelope;
import org.locationtech.jts.geom.Geometry;
import org.locationtech.jts.index.strtree.STRtree;

/**
 * Index to efficiently query which items have a bounding box that intersects another bounding box.
 * <p>
 * Backed by a Sort-Tile-Recursive packed R-tree that gets bulk-loaded in {@code O(n log n)} on the first query, after
 * which queries take {@code O(log n + k)}. Results may contain false positives whose geometries do not actually touch
 * the query geometry, but never miss an item whose bounding box intersects the query box.
 * <p>
 * Writes and reads are thread-safe, but all writes must occur before reads.
 *
 * @param <T> the type of value associated with each bounding box
 */
@ThreadSafe
public class EnvelopeIndex<T> {

  private final STRtree index = new STRtree();
  private volatile boolean built = false;
  private int size = 0;

  private EnvelopeIndex() {}

  public static <T> EnvelopeIndex<T> create() {
    return new EnvelopeIndex<>();
  }

  /** Packs the tree so it can be queried. Called automatically by the first query. */
  public void build() {
    if (!built) {
      synchronized (this) {
        if (!built) {
          index.build();
          built = true;
        }
      }
    }
  }

  /** Indexes {@code item} by the bounding box of {@code geometry}. */
  public void put(Geometry geometry, T item) {
    put(geometry.getEnvelopeInternal(), item);
  }

  /**
   * Indexes {@code item} by {@code envelope}.
   *
   * @throws IllegalStateException if the index has already been queried
   */
  public void put(Envelope envelope, T item) {
    // need to externally synchronize inserts into the STRTree
    synchronized (this) {
      if (built) {
        throw new IllegalStateException("Cannot insert into an index that has already been queried");
      }
      index.insert(envelope, item);
      size++;
    }
  }

  /** Returns every item whose bounding box intersects {@code envelope}. */
  public List<T> query(Envelope envelope) {
    build();
    List<?> items = index.query(envelope);
    List<T> result = new ArrayList<>(items.size());
    for (Object item : items) {
      @SuppressWarnings("unchecked") T t = (T) item;
      result.add(t);
    }
    return result;
  }

  /** Returns every item whose bounding box intersects the bounding box of {@code geometry}. */
  public List<T> query(Geometry geometry) {
    return query(geometry.getEnvelopeInternal());
  }

  public int size() {
    synchronized (this) {
      return size;
    }
  }
}
