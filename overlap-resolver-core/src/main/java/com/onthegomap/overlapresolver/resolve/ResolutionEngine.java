package com.onthegomap.overlapresolver.resolve;

import com.onthegomap.overlapresolver.config.ResolverConfig;
import com.onthegomap.overlapresolver.feature.Feature;
import com.onthegomap.overlapresolver.feature.FeatureKey;
import com.onthegomap.overlapresolver.geo.GeoUtils;
import com.onthegomap.overlapresolver.geo.GeometryException;
import com.onthegomap.overlapresolver.geo.GeometryRepair;
import com.onthegomap.overlapresolver.overlap.Overlap;
import com.onthegomap.overlapresolver.overlap.OverlapGroup;
import com.onthegomap.overlapresolver.stats.Counter;
import com.onthegomap.overlapresolver.stats.Stats;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import org.locationtech.jts.geom.Geometry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Picks the winner of each overlap group and trims the other members.
 * <p>
 * Members are processed from most to least authoritative. The winner keeps its geometry, and each other member loses
 * the area of every higher-ranked member it overlaps directly. A member is never cut by a feature it does not overlap,
 * so parts of a group that are connected only through a chain of other features get resolved independently, and any
 * part of a loser that overlaps nothing survives unchanged.
 */
public class ResolutionEngine {

  private static final Logger LOGGER = LoggerFactory.getLogger(ResolutionEngine.class);

  private final RankingRule rule;
  private final GeometryRepair repair;
  private final Counter.Readable resolved;
  private final Counter.Readable trimmed;
  private final Counter.Readable subsumed;

  public ResolutionEngine(ResolverConfig config, GeometryRepair repair, Stats stats) {
    this(RankingRule.forMode(config.resolutionMode()), repair, stats);
  }

  public ResolutionEngine(RankingRule rule, GeometryRepair repair, Stats stats) {
    this.rule = rule;
    this.repair = repair;
    this.resolved = stats.longCounter("groups_resolved");
    this.trimmed = stats.longCounter("features_trimmed");
    this.subsumed = stats.longCounter("features_subsumed");
  }

  /**
   * Returns the winner and trimmed losers of {@code group}.
   *
   * @throws GeometryException if an overlap region of the group could not be computed, or a trimmed geometry could
   *                           not be computed or repaired
   */
  public ResolutionResult resolve(OverlapGroup group) throws GeometryException {
    if (group.failed()) {
      throw group.failure();
    }
    List<Feature> ranked = rule.rank(group.members());
    Feature winner = ranked.get(0);
    if (!winner.resolutionKey().isRanked()) {
      LOGGER.warn("No member of overlap group {} has a valid datetime, falling back to feature id order: {}",
        group.id(), group.members().stream().map(Feature::key).toList());
    }

    Map<Integer, Integer> position = new HashMap<>();
    for (int i = 0; i < ranked.size(); i++) {
      position.put(ranked.get(i).index(), i);
    }
    Map<Integer, List<Feature>> higherNeighbors = new HashMap<>();
    for (Overlap overlap : group.overlaps()) {
      boolean aFirst = position.get(overlap.a().index()) < position.get(overlap.b().index());
      Feature higher = aFirst ? overlap.a() : overlap.b();
      Feature lower = aFirst ? overlap.b() : overlap.a();
      higherNeighbors.computeIfAbsent(lower.index(), i -> new ArrayList<>()).add(higher);
    }

    Geometry winnerRegion = repair.repair(winner.geometry());
    List<TrimmedFeature> losers = new ArrayList<>(ranked.size() - 1);
    for (Feature member : ranked.subList(1, ranked.size())) {
      losers.add(trim(member, higherNeighbors.getOrDefault(member.index(), List.of())));
    }
    losers.sort(Comparator.comparing(TrimmedFeature::key));
    resolved.inc();
    return new ResolutionResult(group.id(), winner, winnerRegion, losers);
  }

  private TrimmedFeature trim(Feature member, List<Feature> cutBy) throws GeometryException {
    if (cutBy.isEmpty()) {
      return new TrimmedFeature(member, repair.repair(member.geometry()), List.of());
    }
    List<Geometry> cutters = new ArrayList<>(cutBy.size());
    List<FeatureKey> keys = new ArrayList<>(cutBy.size());
    for (Feature feature : cutBy) {
      cutters.add(feature.geometry());
      keys.add(feature.key());
    }
    keys.sort(Comparator.naturalOrder());
    Geometry remainder;
    try {
      remainder = repair.repair(GeoUtils.difference(member.geometry(), GeoUtils.union(cutters)));
    } catch (GeometryException e) {
      throw e.addGeometryDetails(member.key().toString(), member.geometry());
    }
    if (remainder.isEmpty()) {
      subsumed.inc();
    } else {
      trimmed.inc();
    }
    return new TrimmedFeature(member, remainder, keys);
  }
}
