package com.onthegomap.overlapresolver.config;

import java.time.Duration;
import java.util.Collection;
import java.util.Collections;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import org.apache.commons.lang3.StringUtils;

/**
 * Holder for the parameters of an overlap resolution run.
 *
 * @param resolutionMode        rule used to pick the winner of each overlap group, or {@code null} if not configured
 * @param datetimeFields        datetime attribute to read from each layer, keyed by layer id
 * @param detectDatetimeFields  if true, layers without an entry in {@code datetimeFields} get one detected from their
 *                              attribute values
 * @param priorityOrder         layer ids, most authoritative first
 * @param priorityHighestWins   if true, the layer listed last in {@code priorityOrder} wins instead of the first
 * @param areaEpsilon           polygon parts smaller than this area are discarded as slivers
 * @param repairBuffer          distance to expand then contract by when more lightweight geometry repairs fail
 * @param sourceLayerAttribute  output attribute that holds the id of the layer each feature came from
 * @param explodeMultipart      if true, each polygon of a trimmed multipolygon becomes its own output feature
 * @param logInterval           how often to log progress
 */
public record ResolverConfig(
  ResolutionMode resolutionMode,
  Map<String, String> datetimeFields,
  boolean detectDatetimeFields,
  List<String> priorityOrder,
  boolean priorityHighestWins,
  double areaEpsilon,
  double repairBuffer,
  String sourceLayerAttribute,
  boolean explodeMultipart,
  Duration logInterval
) {

  public static final double DEFAULT_AREA_EPSILON = 1e-9;
  public static final double DEFAULT_REPAIR_BUFFER = 1e-7;
  public static final String DEFAULT_SOURCE_LAYER_ATTRIBUTE = "source_layer";

  public ResolverConfig {
    datetimeFields = datetimeFields == null ? Map.of() :
      Collections.unmodifiableMap(new LinkedHashMap<>(datetimeFields));
    priorityOrder = priorityOrder == null ? List.of() : List.copyOf(priorityOrder);
    sourceLayerAttribute = StringUtils.isBlank(sourceLayerAttribute) ? DEFAULT_SOURCE_LAYER_ATTRIBUTE :
      sourceLayerAttribute;
    logInterval = logInterval == null ? Duration.ofSeconds(10) : logInterval;
  }

  /** Returns a datetime-mode config that reads {@code datetimeFields} from each layer. */
  public static ResolverConfig datetime(Map<String, String> datetimeFields) {
    return defaults().withMode(ResolutionMode.DATETIME, datetimeFields, List.of());
  }

  /** Returns a priority-mode config where layers listed first in {@code priorityOrder} win. */
  public static ResolverConfig priority(List<String> priorityOrder) {
    return defaults().withMode(ResolutionMode.PRIORITY, Map.of(), priorityOrder);
  }

  /** Returns a config with no resolution mode and default values for everything else. */
  public static ResolverConfig defaults() {
    return from(Arguments.of());
  }

  /**
   * Returns a config parsed from {@code arguments}.
   *
   * @throws ConfigurationException if a value cannot be parsed
   */
  public static ResolverConfig from(Arguments arguments) {
    try {
      String mode = arguments.getString("resolution_mode", "'datetime' (newest wins) or 'priority' (layer order)",
        null);
      return new ResolverConfig(
        mode == null ? null : ResolutionMode.from(mode),
        arguments.getMap("datetime_fields", "datetime attribute per layer as layer:field,layer:field"),
        arguments.getBoolean("detect_datetime_fields",
          "detect the datetime attribute of layers that have none configured", false),
        arguments.getList("priority_order", "layer ids, most authoritative first", List.of()),
        arguments.getBoolean("priority_highest_wins", "let the layer listed last in priority_order win", false),
        arguments.getDouble("area_epsilon", "discard polygon parts smaller than this area", DEFAULT_AREA_EPSILON),
        arguments.getDouble("repair_buffer", "buffer distance for the last geometry repair attempt",
          DEFAULT_REPAIR_BUFFER),
        arguments.getString("source_layer_attribute", "output attribute holding the source layer id",
          DEFAULT_SOURCE_LAYER_ATTRIBUTE),
        arguments.getBoolean("explode_multipart", "emit one feature per polygon of trimmed multipolygons", false),
        arguments.getDuration("log_interval", "time between progress logs", "10s")
      );
    } catch (ConfigurationException e) {
      throw e;
    } catch (RuntimeException e) {
      throw new ConfigurationException("Invalid resolver arguments: " + e.getMessage(), e);
    }
  }

  /** Returns a copy of this config with a different mode, datetime fields and priority order. */
  public ResolverConfig withMode(ResolutionMode mode, Map<String, String> datetimeFields, List<String> priorityOrder) {
    return new ResolverConfig(mode, datetimeFields, detectDatetimeFields, priorityOrder, priorityHighestWins,
      areaEpsilon, repairBuffer, sourceLayerAttribute, explodeMultipart, logInterval);
  }

  /** Returns a copy of this config with a different sliver area threshold. */
  public ResolverConfig withAreaEpsilon(double newAreaEpsilon) {
    return new ResolverConfig(resolutionMode, datetimeFields, detectDatetimeFields, priorityOrder,
      priorityHighestWins, newAreaEpsilon, repairBuffer, sourceLayerAttribute, explodeMultipart, logInterval);
  }

  /** Returns a copy of this config that detects datetime fields for layers without one configured. */
  public ResolverConfig withDatetimeFieldDetection(boolean detect) {
    return new ResolverConfig(resolutionMode, datetimeFields, detect, priorityOrder, priorityHighestWins,
      areaEpsilon, repairBuffer, sourceLayerAttribute, explodeMultipart, logInterval);
  }

  /** Returns a copy of this config where the layer listed last in the priority order wins. */
  public ResolverConfig withPriorityHighestWins(boolean highestWins) {
    return new ResolverConfig(resolutionMode, datetimeFields, detectDatetimeFields, priorityOrder, highestWins,
      areaEpsilon, repairBuffer, sourceLayerAttribute, explodeMultipart, logInterval);
  }

  /** Returns a copy of this config that splits trimmed multipolygons into one output feature per polygon. */
  public ResolverConfig withExplodeMultipart(boolean explode) {
    return new ResolverConfig(resolutionMode, datetimeFields, detectDatetimeFields, priorityOrder,
      priorityHighestWins, areaEpsilon, repairBuffer, sourceLayerAttribute, explode, logInterval);
  }

  /**
   * Returns the rank of {@code layerId} in the priority order where 0 is the most authoritative, or -1 if the layer is
   * not listed.
   */
  public int priorityRank(String layerId) {
    int index = priorityOrder.indexOf(layerId);
    if (index < 0) {
      return -1;
    }
    return priorityHighestWins ? priorityOrder.size() - 1 - index : index;
  }

  /**
   * Checks that this config can resolve overlaps between {@code layerIds}.
   *
   * @throws ConfigurationException if no mode is set, a layer has no datetime field and detection is off, the priority
   *                                order is empty or misses a layer, or a numeric parameter is out of range
   */
  public void validate(Collection<String> layerIds) {
    if (resolutionMode == null) {
      throw new ConfigurationException("resolution_mode is required: 'datetime' or 'priority'");
    }
    if (!(areaEpsilon >= 0)) {
      throw new ConfigurationException("area_epsilon must be >= 0, got: " + areaEpsilon);
    }
    if (!(repairBuffer > 0)) {
      throw new ConfigurationException("repair_buffer must be > 0, got: " + repairBuffer);
    }
    Set<String> seen = new HashSet<>();
    for (String layerId : layerIds) {
      if (!seen.add(layerId)) {
        throw new ConfigurationException("Duplicate layer id: " + layerId);
      }
    }
    switch (resolutionMode) {
      case DATETIME -> {
        if (!detectDatetimeFields) {
          for (String layerId : layerIds) {
            if (StringUtils.isBlank(datetimeFields.get(layerId))) {
              throw new ConfigurationException("No datetime field configured for layer '" + layerId +
                "', set datetime_fields or detect_datetime_fields=true");
            }
          }
        }
      }
      case PRIORITY -> {
        if (priorityOrder.isEmpty()) {
          throw new ConfigurationException("priority_order must list at least one layer in priority mode");
        }
        if (new HashSet<>(priorityOrder).size() != priorityOrder.size()) {
          throw new ConfigurationException("priority_order lists a layer more than once: " + priorityOrder);
        }
        for (String layerId : layerIds) {
          if (!priorityOrder.contains(layerId)) {
            throw new ConfigurationException("Layer '" + layerId + "' is missing from priority_order " +
              priorityOrder);
          }
        }
      }
    }
  }
}
