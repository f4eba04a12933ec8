package com.onthegomap.overlapresolver.geo;

import com.onthegomap.overlapresolver.stats.Stats;
import java.util.List;
import org.locationtech.jts.geom.Geometry;
import org.locationtech.jts.geom.Polygon;
import org.locationtech.jts.geom.Polygonal;
import org.locationtech.jts.geom.TopologyException;
import org.locationtech.jts.geom.util.GeometryFixer;

/**
 * Turns the output of overlay operations into valid polygons or multipolygons without slivers.
 * <p>
 * A geometry that is already a valid polygon or multipolygon with no part smaller than the area epsilon is returned
 * as-is, so {@code repair(repair(g))} always returns {@code repair(g)}. Anything else goes through a bounded sequence of
 * increasingly aggressive repairs until one produces a clean result.
 */
public class GeometryRepair {

  @FunctionalInterface
  private interface GeometryOperator {

    Geometry apply(Geometry geometry) throws GeometryException;
  }

  private record Attempt(String name, GeometryOperator operator) {}

  private final double areaEpsilon;
  private final Stats stats;
  private final List<Attempt> attempts;

  /**
   * @param areaEpsilon  polygons smaller than this area are dropped
   * @param repairBuffer distance to expand then contract by in the last repair attempt
   * @param stats        where to count which repair attempt fixed each geometry
   */
  public GeometryRepair(double areaEpsilon, double repairBuffer, Stats stats) {
    this.areaEpsilon = areaEpsilon;
    this.stats = stats;
    this.attempts = List.of(
      new Attempt("cleanup", geometry -> geometry),
      new Attempt("fixer", GeometryFixer::fix),
      new Attempt("buffer_zero", GeoUtils::fixPolygon),
      new Attempt("buffer", geometry -> GeoUtils.fixPolygon(geometry, repairBuffer))
    );
  }

  /**
   * Returns a valid polygonal version of {@code geometry} with slivers and non-polygonal components removed, or an empty
   * polygon if nothing is left.
   *
   * @throws GeometryException if none of the repair attempts produce a valid geometry
   */
  public Geometry repair(Geometry geometry) throws GeometryException {
    if (geometry == null || geometry.isEmpty()) {
      return GeoUtils.EMPTY_POLYGON;
    }
    if (isClean(geometry)) {
      return geometry;
    }
    Exception lastError = null;
    for (Attempt attempt : attempts) {
      try {
        Geometry candidate = GeoUtils.polygonalParts(attempt.operator.apply(geometry));
        // area of a self-intersecting polygon is meaningless, so slivers are only removed from valid output
        if (!candidate.isValid()) {
          continue;
        }
        candidate = removeSlivers(candidate);
        if (isClean(candidate)) {
          stats.dataError("repair_" + attempt.name);
          // ring orientation and part order are made consistent so repaired output is reproducible
          return candidate.isEmpty() ? GeoUtils.EMPTY_POLYGON : candidate.norm();
        }
      } catch (GeometryException | TopologyException | IllegalArgumentException e) {
        lastError = e;
      }
    }
    throw new GeometryException("repair_failed",
      "Unable to repair geometry after " + attempts.size() + " attempts", lastError)
      .addGeometryDetails("input", geometry);
  }

  /** Returns true if {@code geometry} is a valid polygon or multipolygon with no part smaller than the area epsilon. */
  public boolean isClean(Geometry geometry) {
    return geometry instanceof Polygonal && geometry.isValid() && !hasSliver(geometry);
  }

  private boolean hasSliver(Geometry geometry) {
    for (Polygon polygon : GeoUtils.polygons(geometry)) {
      if (polygon.getArea() < areaEpsilon) {
        return true;
      }
    }
    return false;
  }

  private Geometry removeSlivers(Geometry geometry) {
    if (!hasSliver(geometry)) {
      return geometry;
    }
    return GeoUtils.combinePolygons(GeoUtils.polygons(geometry).stream()
      .filter(polygon -> polygon.getArea() >= areaEpsilon)
      .toList());
  }
}
