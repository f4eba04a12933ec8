package com.onthegomap.overlapresolver.overlap;

import com.onthegomap.overlapresolver.feature.Feature;
import com.onthegomap.overlapresolver.feature.FeatureStore;
import com.onthegomap.overlapresolver.geo.EnvelopeIndex;
import com.onthegomap.overlapresolver.geo.GeoUtils;
import com.onthegomap.overlapresolver.geo.GeometryException;
import com.onthegomap.overlapresolver.progress.ProgressController;
import com.onthegomap.overlapresolver.stats.Counter;
import com.onthegomap.overlapresolver.stats.Stats;
import com.onthegomap.overlapresolver.util.CloseableIterator;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.NoSuchElementException;
import java.util.Queue;
import org.locationtech.jts.geom.Geometry;
import org.locationtech.jts.geom.TopologyException;
import org.locationtech.jts.geom.prep.PreparedGeometry;
import org.locationtech.jts.geom.prep.PreparedGeometryFactory;

/**
 * Lazily emits the {@link OverlapGroup groups} of features connected through overlapping interiors.
 * <p>
 * Each feature not yet visited in store order starts a breadth-first traversal: candidates come from the spatial index,
 * and a candidate only joins the group if its interior intersects the interior of the feature being expanded, so
 * features that only share a bounding box, an edge or a point stay apart. Every overlapping pair of features is found
 * exactly once and ends up in exactly one group. Features that overlap nothing are skipped.
 */
public class OverlapDetector implements CloseableIterator<OverlapGroup> {

  /** Interiors intersect. */
  private static final String INTERIOR_INTERSECTS = "T********";
  static final int SINGLETON_REPORT_INTERVAL = 1024;

  private final FeatureStore store;
  private final EnvelopeIndex<Feature> index;
  private final ProgressController progress;
  private final boolean[] visited;
  private final boolean[] expanded;
  private final Counter.Readable groupCounter;
  private final Counter.Readable pairCounter;
  private final Counter.Readable candidateCounter;
  private int nextStart = 0;
  private long nextGroupId = 0;
  private long visitedCount = 0;
  private long singletons = 0;
  private OverlapGroup next = null;

  public OverlapDetector(FeatureStore store, EnvelopeIndex<Feature> index, ProgressController progress, Stats stats) {
    this.store = store;
    this.index = index;
    this.progress = progress;
    this.visited = new boolean[store.size()];
    this.expanded = new boolean[store.size()];
    this.groupCounter = stats.longCounter("overlap_groups");
    this.pairCounter = stats.longCounter("overlap_pairs");
    this.candidateCounter = stats.longCounter("overlap_candidates");
  }

  /** Returns the number of features that have been assigned to a group or found to overlap nothing. */
  public long visitedCount() {
    return visitedCount;
  }

  @Override
  public boolean hasNext() {
    if (next == null) {
      next = advance();
    }
    return next != null;
  }

  @Override
  public OverlapGroup next() {
    if (!hasNext()) {
      throw new NoSuchElementException();
    }
    OverlapGroup result = next;
    next = null;
    return result;
  }

  @Override
  public void close() {
    next = null;
    nextStart = store.size();
  }

  private OverlapGroup advance() {
    while (nextStart < store.size()) {
      int start = nextStart++;
      if (visited[start]) {
        continue;
      }
      OverlapGroup group = traverse(store.get(start));
      if (group != null) {
        return group;
      }
      if (++singletons % SINGLETON_REPORT_INTERVAL == 0) {
        progress.report(visitedCount, store.size());
      }
    }
    return null;
  }

  private OverlapGroup traverse(Feature start) {
    List<Feature> members = new ArrayList<>();
    List<Overlap> overlaps = new ArrayList<>();
    GeometryException failure = null;
    Queue<Feature> queue = new ArrayDeque<>();
    visit(start, members, queue);
    while (!queue.isEmpty()) {
      Feature feature = queue.poll();
      expanded[feature.index()] = true;
      Geometry geometry = feature.geometry();
      if (geometry.isEmpty()) {
        continue;
      }
      PreparedGeometry prepared = PreparedGeometryFactory.prepare(geometry);
      for (Feature candidate : index.query(feature.envelope())) {
        // pairs with an expanded feature were already tested from the other side
        if (expanded[candidate.index()]) {
          continue;
        }
        candidateCounter.inc();
        boolean overlapping;
        try {
          overlapping = prepared.intersects(candidate.geometry()) &&
            geometry.relate(candidate.geometry(), INTERIOR_INTERSECTS);
        } catch (TopologyException e) {
          // can't tell, so keep the pair together and fail the group
          overlapping = true;
          if (failure == null) {
            failure = new GeometryException("detect_topology_error",
              "robustness error comparing " + feature.key() + " and " + candidate.key() + ": " + e, e);
          }
        }
        if (!overlapping) {
          continue;
        }
        pairCounter.inc();
        Feature a = feature.index() < candidate.index() ? feature : candidate;
        Feature b = a == feature ? candidate : feature;
        try {
          overlaps.add(new Overlap(a, b, GeoUtils.intersection(a.geometry(), b.geometry())));
        } catch (GeometryException e) {
          if (failure == null) {
            failure = e.addGeometryDetails(a.key().toString(), a.geometry())
              .addGeometryDetails(b.key().toString(), b.geometry());
          }
        }
        if (!visited[candidate.index()]) {
          visit(candidate, members, queue);
        }
      }
    }
    if (members.size() == 1) {
      return null;
    }
    members.sort(Comparator.comparingInt(Feature::index));
    overlaps.sort(Comparator.<Overlap>comparingInt(o -> o.a().index()).thenComparingInt(o -> o.b().index()));
    groupCounter.inc();
    return new OverlapGroup(nextGroupId++, members, overlaps, failure);
  }

  private void visit(Feature feature, List<Feature> members, Queue<Feature> queue) {
    visited[feature.index()] = true;
    visitedCount++;
    members.add(feature);
    queue.add(feature);
  }
}
