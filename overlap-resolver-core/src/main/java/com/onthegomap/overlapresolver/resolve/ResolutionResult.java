package com.onthegomap.overlapresolver.resolve;

import com.onthegomap.overlapresolver.feature.Feature;
import java.util.List;
import org.locationtech.jts.geom.Geometry;

/**
 * The resolved geometries of one overlap group.
 * <p>
 * The winner region and the geometry of every loser together cover the same area as the original members, and none
 * of them overlap.
 *
 * @param groupId      id of the resolved group
 * @param winner       the most authoritative member
 * @param winnerRegion the repaired geometry of the winner
 * @param losers       every other member ordered by key
 */
public record ResolutionResult(long groupId, Feature winner, Geometry winnerRegion, List<TrimmedFeature> losers) {

  public ResolutionResult {
    losers = List.copyOf(losers);
  }
}
