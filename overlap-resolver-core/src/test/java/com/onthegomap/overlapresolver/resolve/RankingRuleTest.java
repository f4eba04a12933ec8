package com.onthegomap.overlapresolver.resolve;

import static com.onthegomap.overlapresolver.TestUtils.rectangle;
import static org.junit.jupiter.api.Assertions.assertEquals;

import com.onthegomap.overlapresolver.config.ResolutionMode;
import com.onthegomap.overlapresolver.feature.Feature;
import com.onthegomap.overlapresolver.feature.FeatureKey;
import com.onthegomap.overlapresolver.feature.ResolutionKey;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;

class RankingRuleTest {

  private static Feature feature(int index, String layer, Object id, ResolutionKey key) {
    return new Feature(index, FeatureKey.of(layer, id), rectangle(0, 1), Map.of(), key);
  }

  private static ResolutionKey time(String instant) {
    return new ResolutionKey.Timestamp(Instant.parse(instant));
  }

  private static List<String> keys(List<Feature> features) {
    return features.stream().map(f -> f.key().toString()).toList();
  }

  @Test
  void testNewestFirst() {
    var rule = RankingRule.forMode(ResolutionMode.DATETIME);
    var ranked = rule.rank(List.of(
      feature(0, "a", 1, time("2020-01-01T00:00:00Z")),
      feature(1, "b", 1, time("2021-06-15T00:00:00Z")),
      feature(2, "c", 1, time("2019-01-01T00:00:00Z"))
    ));
    assertEquals(List.of("b:1", "a:1", "c:1"), keys(ranked));
  }

  @Test
  void testSameTimeBrokenByKey() {
    var rule = RankingRule.forMode(ResolutionMode.DATETIME);
    var ranked = rule.rank(List.of(
      feature(0, "b", 1, time("2021-01-01T00:00:00Z")),
      feature(1, "a", 2, time("2021-01-01T00:00:00Z")),
      feature(2, "a", 10, time("2021-01-01T00:00:00Z"))
    ));
    assertEquals(List.of("a:10", "a:2", "b:1"), keys(ranked));
  }

  @Test
  void testUnrankedLast() {
    var rule = RankingRule.forMode(ResolutionMode.DATETIME);
    var ranked = rule.rank(List.of(
      feature(0, "a", 2, new ResolutionKey.Unranked("missing")),
      feature(1, "z", 1, time("1990-01-01T00:00:00Z")),
      feature(2, "a", 1, new ResolutionKey.Unranked("missing"))
    ));
    assertEquals(List.of("z:1", "a:1", "a:2"), keys(ranked));
  }

  @Test
  void testLowestPriorityRankFirst() {
    var rule = RankingRule.forMode(ResolutionMode.PRIORITY);
    var ranked = rule.rank(List.of(
      feature(0, "z", 1, new ResolutionKey.Priority(2)),
      feature(1, "x", 1, new ResolutionKey.Priority(0)),
      feature(2, "y", 2, new ResolutionKey.Priority(1)),
      feature(3, "y", 1, new ResolutionKey.Priority(1))
    ));
    assertEquals(List.of("x:1", "y:1", "y:2", "z:1"), keys(ranked));
  }
}
