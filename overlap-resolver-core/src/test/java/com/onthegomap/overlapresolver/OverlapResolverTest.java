package com.onthegomap.overlapresolver;

import static com.onthegomap.overlapresolver.TestUtils.assertSameArea;
import static com.onthegomap.overlapresolver.TestUtils.rectangle;
import static org.junit.jupiter.api.Assertions.*;

import com.onthegomap.overlapresolver.config.Arguments;
import com.onthegomap.overlapresolver.config.ResolverConfig;
import com.onthegomap.overlapresolver.feature.FeatureKey;
import com.onthegomap.overlapresolver.geo.GeoUtils;
import com.onthegomap.overlapresolver.geo.GeometryException;
import com.onthegomap.overlapresolver.geo.GeometryRepair;
import com.onthegomap.overlapresolver.progress.CancellableProgress;
import com.onthegomap.overlapresolver.progress.ProgressController;
import com.onthegomap.overlapresolver.reader.InputFeature;
import com.onthegomap.overlapresolver.reader.InputLayer;
import com.onthegomap.overlapresolver.resolve.ResolutionError;
import com.onthegomap.overlapresolver.resolve.ResolutionOutcome;
import com.onthegomap.overlapresolver.resolve.ResolvedFeature;
import com.onthegomap.overlapresolver.stats.Stats;
import com.onthegomap.overlapresolver.writer.FeatureSink;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Random;
import java.util.Set;
import java.util.stream.Collectors;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;
import org.locationtech.jts.geom.Geometry;
import org.locationtech.jts.geom.Polygon;

/**
 * End-to-end tests that run every stage of a resolution on small in-memory layers.
 */
class OverlapResolverTest {

  private final Stats stats = Stats.inMemory();

  private static Map<String, ResolvedFeature> byKey(ResolutionOutcome outcome) {
    Map<String, ResolvedFeature> result = new LinkedHashMap<>();
    for (ResolvedFeature feature : outcome.features().features()) {
      result.put(feature.key() + "#" + feature.fragment(), feature);
    }
    return result;
  }

  private static List<String> keys(ResolutionOutcome outcome) {
    return outcome.features().features().stream().map(f -> f.key().toString()).toList();
  }

  @Test
  void testNewerSquareWinsInDatetimeMode() {
    var a = rectangle(0, 0, 10, 10);
    var b = rectangle(5, 5, 15, 15);
    var outcome = OverlapResolver.create(ResolverConfig.datetime(Map.of("a", "date", "b", "date")))
      .setStats(stats)
      .addLayer("a", List.of(InputFeature.of(1, a, "date", "2020-01-01")))
      .addLayer("b", List.of(InputFeature.of(1, b, "date", "2021-06-15")))
      .run();

    assertEquals(ResolutionOutcome.Status.COMPLETED, outcome.status());
    assertNull(outcome.reason());
    assertEquals(List.of("a:1", "b:1"), keys(outcome));
    var features = byKey(outcome);

    var winner = features.get("b:1#0");
    assertEquals(ResolvedFeature.Status.WINNER, winner.status());
    assertSame(b, winner.geometry());

    var loser = features.get("a:1#0");
    assertEquals(ResolvedFeature.Status.TRIMMED, loser.status());
    assertSameArea(a.difference(b), loser.geometry());
    assertEquals(75, loser.geometry().getArea(), 1e-9);

    assertEquals(1, outcome.results().size());
    assertEquals(FeatureKey.of("b", 1), outcome.results().get(0).winner().key());
    assertEquals(List.of(), outcome.errors());
    assertEquals(1, stats.counters().get("groups_resolved"));
  }

  @Test
  void testPriorityOrderWithUntouchedFeature() {
    var x = rectangle(100, 100, 110, 110);
    var y = rectangle(0, 0, 10, 10);
    var z = rectangle(5, 0, 15, 10);
    var outcome = OverlapResolver.create(ResolverConfig.priority(List.of("LayerX", "LayerY", "LayerZ")))
      .setStats(stats)
      .addLayer("LayerX", List.of(InputFeature.of(1, x)))
      .addLayer("LayerY", List.of(InputFeature.of(1, y)))
      .addLayer("LayerZ", List.of(InputFeature.of(1, z)))
      .run();

    assertTrue(outcome.isCompleted());
    var features = byKey(outcome);
    assertEquals(ResolvedFeature.Status.UNCHANGED, features.get("LayerX:1#0").status());
    assertSame(x, features.get("LayerX:1#0").geometry());
    assertEquals(ResolvedFeature.Status.WINNER, features.get("LayerY:1#0").status());
    assertSame(y, features.get("LayerY:1#0").geometry());
    assertEquals(ResolvedFeature.Status.TRIMMED, features.get("LayerZ:1#0").status());
    assertSameArea(rectangle(10, 0, 15, 10), features.get("LayerZ:1#0").geometry());
  }

  @Test
  void testPriorityHighestWinsReversesOrder() {
    var config = ResolverConfig.from(Arguments.of(
      "resolution_mode", "priority",
      "priority_order", "a,b",
      "priority_highest_wins", "true"
    ));
    var outcome = OverlapResolver.create(config)
      .setStats(stats)
      .addLayer("a", List.of(InputFeature.of(1, rectangle(0, 10))))
      .addLayer("b", List.of(InputFeature.of(1, rectangle(5, 15))))
      .run();
    var features = byKey(outcome);
    assertEquals(ResolvedFeature.Status.WINNER, features.get("b:1#0").status());
    assertEquals(ResolvedFeature.Status.TRIMMED, features.get("a:1#0").status());
  }

  @ParameterizedTest
  @ValueSource(booleans = {false, true})
  void testDisjointRemainderOfLoserSurvives(boolean explode) throws GeometryException {
    var loser = rectangle(0, 0, 30, 10);
    var winner = rectangle(10, -5, 20, 15);
    var outcome = OverlapResolver.create(ResolverConfig.priority(List.of("new", "old")).withExplodeMultipart(explode))
      .setStats(stats)
      .addLayer("old", List.of(InputFeature.of(7, loser)))
      .addLayer("new", List.of(InputFeature.of(1, winner)))
      .run();

    List<ResolvedFeature> trimmed = outcome.features().withStatus(ResolvedFeature.Status.TRIMMED);
    if (explode) {
      assertEquals(2, trimmed.size());
      assertEquals(List.of(0, 1), trimmed.stream().map(ResolvedFeature::fragment).toList());
      for (ResolvedFeature part : trimmed) {
        assertEquals("Polygon", part.geometry().getGeometryType());
        assertEquals(100, part.geometry().getArea(), 1e-9);
        assertEquals(FeatureKey.of("old", 7), part.key());
      }
    } else {
      assertEquals(1, trimmed.size());
      assertEquals(2, trimmed.get(0).geometry().getNumGeometries());
      assertSameArea(GeoUtils.union(List.of(rectangle(0, 0, 10, 10), rectangle(20, 0, 30, 10))),
        trimmed.get(0).geometry());
    }
    assertEquals(1, outcome.features().withStatus(ResolvedFeature.Status.WINNER).size());
  }

  @Test
  void testLoserCoveredByWinnerIsRemoved() {
    var outcome = OverlapResolver.create(ResolverConfig.priority(List.of("big", "small")))
      .setStats(stats)
      .addLayer("big", List.of(InputFeature.of(1, rectangle(0, 100))))
      .addLayer("small", List.of(InputFeature.of(1, rectangle(10, 20))))
      .run();
    assertEquals(List.of("big:1"), keys(outcome));
    assertEquals(1, stats.counters().get("features_subsumed"));
  }

  @Test
  void testAttributesProjectedOntoUnionSchema() {
    var outcome = OverlapResolver.create(ResolverConfig.priority(List.of("a", "b")))
      .setStats(stats)
      .addLayer("a", List.of(InputFeature.of(1, rectangle(0, 10), "name", "lot 1", "source_layer", "stale")))
      .addLayer("b", List.of(InputFeature.of("ff", rectangle(20, 30), "height", 3)))
      .run();

    assertEquals(List.of("name", "height", "source_layer"), outcome.features().schema().fieldNames());
    var features = byKey(outcome);
    Map<String, Object> expectedA = new HashMap<>();
    expectedA.put("name", "lot 1");
    expectedA.put("height", null);
    expectedA.put("source_layer", "a");
    assertEquals(expectedA, features.get("a:1#0").attributes());
    assertEquals(List.of("name", "height", "source_layer"),
      new ArrayList<>(features.get("a:1#0").attributes().keySet()));

    Map<String, Object> expectedB = new HashMap<>();
    expectedB.put("name", null);
    expectedB.put("height", 3);
    expectedB.put("source_layer", "b");
    assertEquals(expectedB, features.get("b:ff#0").attributes());
  }

  @Test
  void testCustomSourceLayerAttribute() {
    var config = ResolverConfig.from(Arguments.of(
      "resolution_mode", "priority",
      "priority_order", "a",
      "source_layer_attribute", "origin"
    ));
    var outcome = OverlapResolver.create(config)
      .setStats(stats)
      .addLayer("a", List.of(InputFeature.of(1, rectangle(0, 10))))
      .run();
    assertEquals("a", outcome.features().features().get(0).getString("origin"));
  }

  @Test
  void testRunsAreReproducible() {
    List<InputLayer> layers = randomLayers(new Random(1), 3, 12);
    var config = ResolverConfig.priority(List.of("layer0", "layer1", "layer2"));
    var first = OverlapResolver.resolve(layers, config, ProgressController.NONE);
    var second = OverlapResolver.resolve(layers, config, ProgressController.NONE);

    assertEquals(keys(first), keys(second));
    for (int i = 0; i < first.features().size(); i++) {
      var a = first.features().features().get(i);
      var b = second.features().features().get(i);
      assertEquals(a.status(), b.status());
      assertTrue(a.geometry().equalsExact(b.geometry()), "feature " + a.key());
    }
  }

  @ParameterizedTest
  @ValueSource(ints = {1, 2, 3, 4})
  void testOutputIsNonOverlappingPartitionOfInput(int seed) throws GeometryException {
    List<InputLayer> layers = randomLayers(new Random(seed), 3, 15);
    var outcome = OverlapResolver.resolve(layers, ResolverConfig.priority(List.of("layer2", "layer0", "layer1")),
      ProgressController.NONE);
    assertTrue(outcome.isCompleted());

    List<Geometry> outputs = outcome.features().features().stream().map(ResolvedFeature::geometry).toList();
    for (int i = 0; i < outputs.size(); i++) {
      for (int j = i + 1; j < outputs.size(); j++) {
        assertEquals(0, outputs.get(i).intersection(outputs.get(j)).getArea(), 1e-6,
          "overlap between output " + i + " and " + j);
      }
    }
    List<Geometry> inputs = new ArrayList<>();
    for (InputLayer layer : layers) {
      for (InputFeature feature : layer.featureList()) {
        inputs.add(feature.geometry());
      }
    }
    double outputArea = outputs.stream().mapToDouble(Geometry::getArea).sum();
    assertEquals(GeoUtils.union(inputs).getArea(), outputArea, 1e-6);
  }

  @Test
  void testCancelAfterFirstGroup() {
    var progress = new CancellableProgress() {
      @Override
      public void report(long completed, long total) {
        super.report(completed, total);
        cancel();
      }
    };
    var outcome = OverlapResolver.create(ResolverConfig.priority(List.of("a", "b")))
      .setStats(stats)
      .setProgress(progress)
      .addLayer("a", List.of(
        InputFeature.of(1, rectangle(0, 10)),
        InputFeature.of(2, rectangle(100, 110))
      ))
      .addLayer("b", List.of(
        InputFeature.of(1, rectangle(5, 15)),
        InputFeature.of(2, rectangle(105, 115))
      ))
      .run();

    assertEquals(ResolutionOutcome.Status.CANCELLED, outcome.status());
    assertTrue(outcome.features().isEmpty());
    assertEquals(1, outcome.results().size());
    assertEquals(FeatureKey.of("a", 1), outcome.results().get(0).winner().key());
    assertNotNull(outcome.reason());
  }

  @Test
  void testConfigurationErrorFailsBeforeIndexing() {
    var outcome = OverlapResolver.create(ResolverConfig.priority(List.of("a")))
      .setStats(stats)
      .addLayer("a", List.of(InputFeature.of(1, rectangle(0, 10))))
      .addLayer("b", List.of(InputFeature.of(1, rectangle(5, 15))))
      .run();

    assertEquals(ResolutionOutcome.Status.FAILED, outcome.status());
    assertTrue(outcome.features().isEmpty());
    assertEquals(1, outcome.errors(ResolutionError.Kind.CONFIGURATION).size());
    assertTrue(outcome.reason().contains("'b'"), outcome.reason());
    assertFalse(stats.timers().all().containsKey("index"));
    assertFalse(stats.timers().all().containsKey("resolve"));
  }

  @Test
  void testMissingResolutionModeFails() {
    var outcome = OverlapResolver.create(Arguments.of())
      .setStats(stats)
      .addLayer("a", List.of(InputFeature.of(1, rectangle(0, 10))))
      .run();
    assertEquals(ResolutionOutcome.Status.FAILED, outcome.status());
    assertTrue(outcome.reason().contains("resolution_mode"));
  }

  @Test
  void testSelfIntersectingInputIsRepairedThenResolved() {
    var outcome = OverlapResolver.create(ResolverConfig.priority(List.of("a", "b")))
      .setStats(stats)
      .addLayer("a", List.of(InputFeature.of(1, TestUtils.bowTie())))
      .addLayer("b", List.of(InputFeature.of(1, rectangle(0.5, 0, 2, 1))))
      .run();

    assertTrue(outcome.isCompleted());
    assertEquals(List.of(), outcome.errors());
    var features = byKey(outcome);
    var a = features.get("a:1#0");
    assertEquals(ResolvedFeature.Status.WINNER, a.status());
    assertEquals(0.5, a.geometry().getArea(), 1e-9);
    var b = features.get("b:1#0");
    assertEquals(ResolvedFeature.Status.TRIMMED, b.status());
    assertEquals(1.25, b.geometry().getArea(), 1e-9);
    assertEquals(0, a.geometry().intersection(b.geometry()).getArea(), 1e-9);
  }

  @Test
  void testInputThatRepairsToNothingIsReportedNotEmitted() {
    var outcome = OverlapResolver.create(ResolverConfig.priority(List.of("a")))
      .setStats(stats)
      .addLayer("a", List.of(
        InputFeature.of(1, TestUtils.newPolygon(0, 0, 1, 0, 2, 0, 0, 0)),
        InputFeature.of(2, rectangle(0, 1))
      ))
      .run();

    assertTrue(outcome.isCompleted());
    assertEquals(List.of("a:2"), keys(outcome));
    assertEquals(FeatureKey.of("a", 1), outcome.errors(ResolutionError.Kind.INVALID_GEOMETRY).get(0).feature());
  }

  @Test
  void testFailedGroupKeepsOriginalGeometriesAndOtherGroupsContinue() {
    var repair = new GeometryRepair(1e-9, 1e-7, stats) {
      @Override
      public Geometry repair(Geometry geometry) throws GeometryException {
        if (geometry.getEnvelopeInternal().getMinX() >= 100) {
          throw new GeometryException("repair_failed", "unable to repair");
        }
        return super.repair(geometry);
      }
    };
    Polygon bad1 = rectangle(100, 110);
    Polygon bad2 = rectangle(105, 115);
    var outcome = OverlapResolver.create(ResolverConfig.priority(List.of("a", "b")))
      .setStats(stats)
      .setGeometryRepair(repair)
      .addLayer("a", List.of(InputFeature.of(1, rectangle(0, 10)), InputFeature.of(2, bad1)))
      .addLayer("b", List.of(InputFeature.of(1, rectangle(5, 15)), InputFeature.of(2, bad2)))
      .run();

    assertTrue(outcome.isCompleted());
    var features = byKey(outcome);
    assertEquals(ResolvedFeature.Status.WINNER, features.get("a:1#0").status());
    assertEquals(ResolvedFeature.Status.TRIMMED, features.get("b:1#0").status());
    assertEquals(ResolvedFeature.Status.UNRESOLVED, features.get("a:2#0").status());
    assertSame(bad1, features.get("a:2#0").geometry());
    assertEquals(ResolvedFeature.Status.UNRESOLVED, features.get("b:2#0").status());
    assertSame(bad2, features.get("b:2#0").geometry());

    var errors = outcome.errors(ResolutionError.Kind.INVALID_GEOMETRY);
    assertEquals(Set.of(FeatureKey.of("a", 2), FeatureKey.of("b", 2)),
      errors.stream().map(ResolutionError::feature).collect(Collectors.toSet()));
    assertTrue(errors.stream().allMatch(ResolutionError::hasGroup));
    assertEquals(1, outcome.results().size());
  }

  @Test
  void testUnparseableDatetimeCannotWin() {
    var outcome = OverlapResolver.create(ResolverConfig.datetime(Map.of("a", "date", "b", "date")))
      .setStats(stats)
      .addLayer("a", List.of(InputFeature.of(1, rectangle(0, 10), "date", "not a date")))
      .addLayer("b", List.of(InputFeature.of(1, rectangle(5, 15), "date", "1999-01-01")))
      .run();

    assertTrue(outcome.isCompleted());
    var features = byKey(outcome);
    assertEquals(ResolvedFeature.Status.WINNER, features.get("b:1#0").status());
    assertEquals(ResolvedFeature.Status.TRIMMED, features.get("a:1#0").status());
    var errors = outcome.errors(ResolutionError.Kind.UNPARSEABLE_DATETIME);
    assertEquals(1, errors.size());
    assertEquals(FeatureKey.of("a", 1), errors.get(0).feature());
    assertFalse(errors.get(0).hasGroup());
  }

  @Test
  void testDetectedDatetimeField() {
    var outcome = OverlapResolver.create(ResolverConfig.datetime(Map.of()).withDatetimeFieldDetection(true))
      .setStats(stats)
      .addLayer("a", List.of(InputFeature.of(1, rectangle(0, 10), "name", "x", "survey_date", "2020-01-01")))
      .addLayer("b", List.of(InputFeature.of(1, rectangle(5, 15), "name", "y", "updated", "2021-06-15")))
      .run();
    assertTrue(outcome.isCompleted());
    assertEquals(ResolvedFeature.Status.WINNER, byKey(outcome).get("b:1#0").status());
  }

  @Test
  void testDetectOverlaps() {
    var report = OverlapResolver.create(ResolverConfig.priority(List.of("a", "b")))
      .setStats(stats)
      .addLayer("a", List.of(InputFeature.of(1, rectangle(0, 10)), InputFeature.of(2, rectangle(50, 60))))
      .addLayer("b", List.of(InputFeature.of(1, rectangle(5, 15))))
      .detectOverlaps();

    assertFalse(report.isEmpty());
    assertEquals(1, report.groupCount());
    assertEquals(1, report.overlaps().size());
    assertEquals(25, report.totalArea(), 1e-9);
    assertEquals(0, report.failedGroups());
  }

  @Test
  void testWriteToSink() {
    var outcome = OverlapResolver.create(ResolverConfig.priority(List.of("a", "b")))
      .setStats(stats)
      .addLayer("a", List.of(InputFeature.of(1, rectangle(0, 10))))
      .addLayer("b", List.of(InputFeature.of(1, rectangle(5, 15))))
      .run();
    List<ResolvedFeature> written = new ArrayList<>();
    outcome.features().writeTo(FeatureSink.collect(written));
    assertEquals(outcome.features().features(), written);
  }

  private static List<InputLayer> randomLayers(Random random, int layerCount, int featuresPerLayer) {
    List<InputLayer> layers = new ArrayList<>();
    for (int l = 0; l < layerCount; l++) {
      InputFeature[] features = new InputFeature[featuresPerLayer];
      for (int i = 0; i < featuresPerLayer; i++) {
        int x = random.nextInt(80);
        int y = random.nextInt(80);
        int w = 5 + random.nextInt(20);
        int h = 5 + random.nextInt(20);
        features[i] = InputFeature.of(i, rectangle(x, y, x + w, y + h), "n", i);
      }
      layers.add(InputLayer.of("layer" + l, features));
    }
    return layers;
  }
}
