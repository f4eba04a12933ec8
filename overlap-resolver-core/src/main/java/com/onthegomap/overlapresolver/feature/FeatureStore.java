package com.onthegomap.overlapresolver.feature;

import com.onthegomap.overlapresolver.config.ConfigurationException;
import com.onthegomap.overlapresolver.config.ResolutionMode;
import com.onthegomap.overlapresolver.config.ResolverConfig;
import com.onthegomap.overlapresolver.geo.EnvelopeIndex;
import com.onthegomap.overlapresolver.geo.GeoUtils;
import com.onthegomap.overlapresolver.geo.GeometryException;
import com.onthegomap.overlapresolver.geo.GeometryRepair;
import com.onthegomap.overlapresolver.reader.FeatureSource;
import com.onthegomap.overlapresolver.reader.InputFeature;
import com.onthegomap.overlapresolver.resolve.ResolutionError;
import com.onthegomap.overlapresolver.stats.Counter;
import com.onthegomap.overlapresolver.stats.Stats;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import org.locationtech.jts.geom.Geometry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * The normalized in-memory copy of every input feature, loaded once before overlaps are detected and read-only after.
 * <p>
 * Loading checks that every feature has a unique id within its layer and a polygonal geometry, repairs invalid input
 * geometries, and computes the resolution key of each feature from the active resolution mode.
 */
public class FeatureStore {

  private static final Logger LOGGER = LoggerFactory.getLogger(FeatureStore.class);

  private final List<Feature> features;
  private final List<String> layerIds;
  private final Map<String, String> datetimeFields;
  private final AttributeSchema schema;
  private final List<ResolutionError> errors;

  private FeatureStore(List<Feature> features, List<String> layerIds, Map<String, String> datetimeFields,
    AttributeSchema schema, List<ResolutionError> errors) {
    this.features = Collections.unmodifiableList(features);
    this.layerIds = List.copyOf(layerIds);
    this.datetimeFields = Collections.unmodifiableMap(datetimeFields);
    this.schema = schema;
    this.errors = Collections.unmodifiableList(errors);
  }

  /**
   * Reads every feature from {@code sources} in order.
   *
   * @throws ConfigurationException if {@code config} does not fit the layers, a layer repeats a feature id, a feature
   *                                has a missing or non-polygonal geometry, or no datetime field can be detected
   */
  public static FeatureStore load(List<? extends FeatureSource> sources, ResolverConfig config, GeometryRepair repair,
    Stats stats) {
    List<String> layerIds = sources.stream().map(FeatureSource::layerId).toList();
    config.validate(layerIds);

    Counter.Readable loaded = stats.longCounter("features_loaded");
    List<Feature> features = new ArrayList<>();
    Set<String> fields = new LinkedHashSet<>();
    Map<String, String> datetimeFields = new LinkedHashMap<>();
    List<ResolutionError> errors = new ArrayList<>();

    for (FeatureSource source : sources) {
      String layerId = source.layerId();
      List<InputFeature> inputs = readAll(source);
      Set<String> layerFields = new LinkedHashSet<>();
      for (InputFeature input : inputs) {
        layerFields.addAll(input.attributes().keySet());
      }
      fields.addAll(layerFields);

      String datetimeField = null;
      if (config.resolutionMode() == ResolutionMode.DATETIME) {
        datetimeField = datetimeField(layerId, layerFields, inputs, config);
        datetimeFields.put(layerId, datetimeField);
      }

      Set<String> ids = new HashSet<>();
      for (InputFeature input : inputs) {
        if (input.id() == null) {
          throw new ConfigurationException("Feature without an id in layer '" + layerId + "'");
        }
        FeatureKey key = FeatureKey.of(layerId, input.id());
        if (!ids.add(key.id())) {
          throw new ConfigurationException("Duplicate feature id " + key);
        }
        Geometry geometry = input.geometry();
        if (!GeoUtils.isPolygonal(geometry)) {
          throw new ConfigurationException("Feature " + key + " has a non-polygonal geometry: " +
            (geometry == null ? "null" : geometry.getGeometryType()));
        }
        if (!geometry.isValid()) {
          try {
            geometry = repair.repair(geometry);
            if (geometry.isEmpty()) {
              throw new GeometryException("repair_empty", "Nothing left of invalid geometry after repair")
                .addGeometryDetails("input", input.geometry());
            }
            stats.dataError("load_repaired");
          } catch (GeometryException e) {
            e.log(stats, "load", "Excluding feature " + key + " with unrepairable geometry");
            errors.add(ResolutionError.invalidGeometry(ResolutionError.NO_GROUP, key, e));
            continue;
          }
        }
        ResolutionKey resolutionKey = switch (config.resolutionMode()) {
          case PRIORITY -> new ResolutionKey.Priority(config.priorityRank(layerId));
          case DATETIME -> timestampKey(key, input, datetimeField, errors, stats);
        };
        features.add(new Feature(features.size(), key, geometry, input.attributes(), resolutionKey));
        loaded.inc();
      }
    }
    LOGGER.info("Loaded {} features from {} layers", features.size(), layerIds.size());
    return new FeatureStore(features, layerIds, datetimeFields,
      AttributeSchema.union(fields, config.sourceLayerAttribute()), errors);
  }

  private static List<InputFeature> readAll(FeatureSource source) {
    List<InputFeature> result = new ArrayList<>();
    try (var iter = source.features()) {
      while (iter.hasNext()) {
        result.add(iter.next());
      }
    }
    return result;
  }

  private static String datetimeField(String layerId, Set<String> layerFields, List<InputFeature> inputs,
    ResolverConfig config) {
    String configured = config.datetimeFields().get(layerId);
    if (configured != null && !configured.isBlank()) {
      return configured;
    }
    String detected = DatetimeFieldDetector.detect(layerId, layerFields, inputs)
      .orElseThrow(() -> new ConfigurationException("Unable to detect a datetime field for layer '" + layerId +
        "', set datetime_fields"));
    LOGGER.info("Using detected datetime field '{}' for layer '{}'", detected, layerId);
    return detected;
  }

  private static ResolutionKey timestampKey(FeatureKey key, InputFeature input, String field,
    List<ResolutionError> errors, Stats stats) {
    Object value = input.getAttribute(field);
    Instant time = input.getTimestamp(field);
    if (time != null) {
      return new ResolutionKey.Timestamp(time);
    }
    var error = ResolutionError.unparseableDatetime(key, field, value);
    LOGGER.warn("{}: {}, feature cannot win an overlap", key, error.message());
    stats.dataError(value == null ? "datetime_missing" : "datetime_unparseable");
    errors.add(error);
    return new ResolutionKey.Unranked(error.message());
  }

  /** Returns a spatial index over the bounding box of every feature, built in one pass. */
  public EnvelopeIndex<Feature> buildIndex() {
    EnvelopeIndex<Feature> index = EnvelopeIndex.create();
    for (Feature feature : features) {
      if (!feature.geometry().isEmpty()) {
        index.put(feature.geometry(), feature);
      }
    }
    index.build();
    return index;
  }

  /** Returns every feature ordered by {@link Feature#index()}. */
  public List<Feature> features() {
    return features;
  }

  public Feature get(int index) {
    return features.get(index);
  }

  public int size() {
    return features.size();
  }

  public List<String> layerIds() {
    return layerIds;
  }

  /** Returns the datetime field read from each layer in datetime mode, including detected ones. */
  public Map<String, String> datetimeFields() {
    return datetimeFields;
  }

  public AttributeSchema schema() {
    return schema;
  }

  /** Returns the non-fatal problems found while loading. */
  public List<ResolutionError> errors() {
    return errors;
  }
}
