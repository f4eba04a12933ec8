package com.onthegomap.overlapresolver.resolve;

import com.onthegomap.overlapresolver.config.ResolutionMode;
import com.onthegomap.overlapresolver.feature.Feature;
import com.onthegomap.overlapresolver.feature.ResolutionKey;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * Orders the members of an overlap group from most to least authoritative.
 * <p>
 * Ties are broken by {@link com.onthegomap.overlapresolver.feature.FeatureKey} so the order never depends on input
 * order.
 */
public class RankingRule implements Comparator<Feature> {

  private final ResolutionMode mode;

  private RankingRule(ResolutionMode mode) {
    this.mode = mode;
  }

  /** Returns the rule for {@code mode}. */
  public static RankingRule forMode(ResolutionMode mode) {
    return new RankingRule(mode);
  }

  public ResolutionMode mode() {
    return mode;
  }

  @Override
  public int compare(Feature a, Feature b) {
    int result = compareKeys(a.resolutionKey(), b.resolutionKey());
    if (result == 0) {
      result = a.key().compareTo(b.key());
    }
    return result;
  }

  private static int compareKeys(ResolutionKey a, ResolutionKey b) {
    if (a.isRanked() != b.isRanked()) {
      return a.isRanked() ? -1 : 1;
    }
    if (a instanceof ResolutionKey.Timestamp ta && b instanceof ResolutionKey.Timestamp tb) {
      // newest first
      return tb.time().compareTo(ta.time());
    } else if (a instanceof ResolutionKey.Priority pa && b instanceof ResolutionKey.Priority pb) {
      return Integer.compare(pa.rank(), pb.rank());
    }
    return 0;
  }

  /** Returns a copy of {@code members} sorted from most to least authoritative. */
  public List<Feature> rank(List<Feature> members) {
    List<Feature> result = new ArrayList<>(members);
    result.sort(this);
    return result;
  }
}
