package com.onthegomap.overlapresolver;

import com.onthegomap.overlapresolver.config.Arguments;
import com.onthegomap.overlapresolver.config.ConfigurationException;
import com.onthegomap.overlapresolver.config.ResolverConfig;
import com.onthegomap.overlapresolver.feature.AttributeSchema;
import com.onthegomap.overlapresolver.feature.Feature;
import com.onthegomap.overlapresolver.feature.FeatureStore;
import com.onthegomap.overlapresolver.geo.EnvelopeIndex;
import com.onthegomap.overlapresolver.geo.GeoUtils;
import com.onthegomap.overlapresolver.geo.GeometryException;
import com.onthegomap.overlapresolver.geo.GeometryRepair;
import com.onthegomap.overlapresolver.overlap.OverlapDetector;
import com.onthegomap.overlapresolver.overlap.OverlapGroup;
import com.onthegomap.overlapresolver.overlap.OverlapReport;
import com.onthegomap.overlapresolver.progress.LoggingProgress;
import com.onthegomap.overlapresolver.progress.ProgressController;
import com.onthegomap.overlapresolver.reader.FeatureSource;
import com.onthegomap.overlapresolver.reader.InputFeature;
import com.onthegomap.overlapresolver.reader.InputLayer;
import com.onthegomap.overlapresolver.resolve.ResolutionEngine;
import com.onthegomap.overlapresolver.resolve.ResolutionError;
import com.onthegomap.overlapresolver.resolve.ResolutionOutcome;
import com.onthegomap.overlapresolver.resolve.ResolutionResult;
import com.onthegomap.overlapresolver.resolve.ResolvedFeature;
import com.onthegomap.overlapresolver.resolve.ResolvedFeatureSet;
import com.onthegomap.overlapresolver.resolve.TrimmedFeature;
import com.onthegomap.overlapresolver.stats.Stats;
import com.onthegomap.overlapresolver.stats.Timers;
import java.util.ArrayList;
import java.util.List;
import org.locationtech.jts.geom.Geometry;
import org.locationtech.jts.geom.Polygon;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * High-level API for resolving overlaps between polygon layers that ties together the lower-level utilities.
 * <p>
 * For example:
 *
 * <pre>
 * <code>
 * ResolutionOutcome outcome = OverlapResolver.create(Arguments.fromArgs(args))
 *   .addLayer(parcels2019)
 *   .addLayer(parcels2021)
 *   .setProgress(progress)
 *   .run();
 * outcome.features().writeTo(sink);
 * </code>
 * </pre>
 * <p>
 * A run validates the configuration, loads every layer into a {@link FeatureStore}, indexes the features, then
 * resolves each {@link OverlapGroup} in turn. Each call to a builder API mutates the resolver and returns it for more
 * chaining.
 */
@SuppressWarnings("UnusedReturnValue")
public class OverlapResolver {

  private static final Logger LOGGER = LoggerFactory.getLogger(OverlapResolver.class);

  private final ResolverConfig config;
  private final List<FeatureSource> layers = new ArrayList<>();
  private Stats stats = Stats.inMemory();
  private ProgressController progress = ProgressController.NONE;
  private GeometryRepair repair;

  private OverlapResolver(ResolverConfig config) {
    this.config = config;
  }

  private GeometryRepair repair() {
    if (repair == null) {
      repair = new GeometryRepair(config.areaEpsilon(), config.repairBuffer(), stats);
    }
    return repair;
  }

  /**
   * Returns a new resolver with no layers that gets configuration from {@code arguments}.
   *
   * @throws ConfigurationException if an argument cannot be parsed
   */
  public static OverlapResolver create(Arguments arguments) {
    return new OverlapResolver(ResolverConfig.from(arguments));
  }

  /** Returns a new resolver with no layers that uses {@code config}. */
  public static OverlapResolver create(ResolverConfig config) {
    return new OverlapResolver(config);
  }

  /** Resolves the overlaps between {@code layers} and returns the outcome. */
  public static ResolutionOutcome resolve(List<? extends FeatureSource> layers, ResolverConfig config,
    ProgressController progress) {
    var resolver = create(config).setProgress(progress);
    layers.forEach(resolver::addLayer);
    return resolver.run();
  }

  /**
   * Adds a layer to resolve. Layers added first come first in the output.
   *
   * @return this resolver for chaining
   */
  public OverlapResolver addLayer(FeatureSource layer) {
    layers.add(layer);
    return this;
  }

  /** Adds an in-memory layer with {@code id} to resolve. */
  public OverlapResolver addLayer(String id, List<InputFeature> features) {
    return addLayer(new InputLayer(id, features));
  }

  public OverlapResolver setStats(Stats stats) {
    this.stats = stats;
    return this;
  }

  /** Sets the controller that receives progress updates and can cancel the run. */
  public OverlapResolver setProgress(ProgressController progress) {
    this.progress = progress;
    return this;
  }

  /** Replaces the geometry repair built from {@code area_epsilon} and {@code repair_buffer}. */
  public OverlapResolver setGeometryRepair(GeometryRepair repair) {
    this.repair = repair;
    return this;
  }

  public ResolverConfig config() {
    return config;
  }

  public Stats stats() {
    return stats;
  }

  /**
   * Finds every overlap without resolving anything.
   *
   * @throws ConfigurationException if the configuration does not fit the layers
   */
  public OverlapReport detectOverlaps() {
    FeatureStore store = load();
    EnvelopeIndex<Feature> index = index(store);
    try (var detector = new OverlapDetector(store, index, ProgressController.NONE, stats)) {
      OverlapReport report = OverlapReport.of(detector);
      LOGGER.info(report.summary());
      return report;
    }
  }

  /**
   * Resolves the overlaps between every layer that was added.
   * <p>
   * Configuration errors produce a {@link ResolutionOutcome.Status#FAILED FAILED} outcome before anything is indexed.
   * Groups whose geometry cannot be resolved keep their original geometries and are reported as errors without
   * stopping the run.
   */
  public ResolutionOutcome run() {
    try {
      return doRun();
    } catch (ConfigurationException e) {
      LOGGER.error("Invalid configuration: {}", e.getMessage());
      return ResolutionOutcome.failed(ResolvedFeatureSet.empty(emptySchema()),
        List.of(ResolutionError.configuration(e.getMessage())), e.getMessage());
    } finally {
      stats.printSummary();
    }
  }

  private ResolutionOutcome doRun() {
    FeatureStore store = load();
    EnvelopeIndex<Feature> index = index(store);

    int total = store.size();
    List<ResolutionResult> results = new ArrayList<>();
    List<ResolutionError> errors = new ArrayList<>(store.errors());
    // output fragments of each feature by store index, null for features that overlap nothing
    List<List<ResolvedFeature>> outputs = new ArrayList<>(total);
    for (int i = 0; i < total; i++) {
      outputs.add(null);
    }
    var engine = new ResolutionEngine(config, repair(), stats);
    var logger = new LoggingProgress("resolve", config.logInterval(), progress);
    boolean cancelled = false;

    Timers.Finishable timer = stats.startStage("resolve");
    try (var detector = new OverlapDetector(store, index, logger, stats)) {
      while (detector.hasNext()) {
        OverlapGroup group = detector.next();
        if (logger.isCancelled()) {
          cancelled = true;
          break;
        }
        try {
          ResolutionResult result = engine.resolve(group);
          results.add(result);
          addOutputs(result, store.schema(), outputs);
        } catch (GeometryException e) {
          e.log(stats, "resolve", "Unable to resolve overlap group " + group.id() + ", keeping original geometries");
          for (Feature member : group.members()) {
            errors.add(ResolutionError.invalidGeometry(group.id(), member.key(), e));
            outputs.set(member.index(), List.of(output(member, member.geometry(), store.schema(),
              ResolvedFeature.Status.UNRESOLVED, 0)));
          }
        }
        logger.report(detector.visitedCount(), total);
      }
    } finally {
      timer.stop();
    }

    if (cancelled) {
      LOGGER.info("Cancelled after resolving {} overlap groups", results.size());
      return ResolutionOutcome.cancelled(ResolvedFeatureSet.empty(store.schema()), results, errors);
    }
    logger.report(total, total);

    List<ResolvedFeature> features = new ArrayList<>(total);
    for (Feature feature : store.features()) {
      List<ResolvedFeature> fragments = outputs.get(feature.index());
      if (fragments == null) {
        features.add(output(feature, feature.geometry(), store.schema(), ResolvedFeature.Status.UNCHANGED, 0));
      } else {
        features.addAll(fragments);
      }
    }
    LOGGER.info("Resolved {} overlap groups into {} output features", results.size(), features.size());
    return ResolutionOutcome.completed(new ResolvedFeatureSet(store.schema(), features), results, errors);
  }

  private FeatureStore load() {
    var timer = stats.startStage("load");
    try {
      return FeatureStore.load(layers, config, repair(), stats);
    } finally {
      timer.stop();
    }
  }

  private EnvelopeIndex<Feature> index(FeatureStore store) {
    var timer = stats.startStage("index");
    try {
      return store.buildIndex();
    } finally {
      timer.stop();
    }
  }

  private void addOutputs(ResolutionResult result, AttributeSchema schema, List<List<ResolvedFeature>> outputs) {
    Feature winner = result.winner();
    outputs.set(winner.index(), fragments(winner, result.winnerRegion(), schema, ResolvedFeature.Status.WINNER));
    for (TrimmedFeature loser : result.losers()) {
      Feature feature = loser.feature();
      ResolvedFeature.Status status =
        loser.isUntouched() ? ResolvedFeature.Status.WINNER : ResolvedFeature.Status.TRIMMED;
      outputs.set(feature.index(), loser.isSubsumed() ? List.of() : fragments(feature, loser.geometry(), schema,
        status));
    }
  }

  private List<ResolvedFeature> fragments(Feature feature, Geometry geometry, AttributeSchema schema,
    ResolvedFeature.Status status) {
    if (geometry.isEmpty()) {
      return List.of();
    }
    if (status != ResolvedFeature.Status.TRIMMED || !config.explodeMultipart() || geometry.getNumGeometries() == 1) {
      return List.of(output(feature, geometry, schema, status, 0));
    }
    List<Polygon> parts = GeoUtils.polygons(geometry);
    List<ResolvedFeature> result = new ArrayList<>(parts.size());
    for (int i = 0; i < parts.size(); i++) {
      result.add(output(feature, parts.get(i), schema, status, i));
    }
    return result;
  }

  private static ResolvedFeature output(Feature feature, Geometry geometry, AttributeSchema schema,
    ResolvedFeature.Status status, int fragment) {
    return new ResolvedFeature(feature.key(), geometry, schema.project(feature.attributes(), feature.sourceLayer()),
      status, fragment);
  }

  private AttributeSchema emptySchema() {
    return AttributeSchema.union(List.of(), config.sourceLayerAttribute());
  }
}
