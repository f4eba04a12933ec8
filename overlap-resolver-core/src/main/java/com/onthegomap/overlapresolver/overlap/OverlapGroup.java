package com.onthegomap.overlapresolver.overlap;

import com.onthegomap.overlapresolver.feature.Feature;
import com.onthegomap.overlapresolver.geo.GeometryException;
import java.util.List;

/**
 * A maximal set of features connected through pairwise overlaps.
 *
 * @param id       sequence number of this group in emission order, starting at 0
 * @param members  every feature in the group, ordered by store index
 * @param overlaps every overlapping pair within the group, ordered by store index of both features
 * @param failure  the error that prevented computing an overlap region, or null if all of them succeeded
 */
public record OverlapGroup(long id, List<Feature> members, List<Overlap> overlaps, GeometryException failure) {

  public OverlapGroup {
    members = List.copyOf(members);
    overlaps = List.copyOf(overlaps);
  }

  public boolean failed() {
    return failure != null;
  }

  public int size() {
    return members.size();
  }

  @Override
  public String toString() {
    return "OverlapGroup{id=" + id + " members=" + members.stream().map(Feature::key).toList() +
      (failed() ? " failed" : "") + "}";
  }
}
