package com.onthegomap.overlapresolver.geo;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import org.locationtech.jts.geom.Geometry;
import org.locationtech.jts.geom.GeometryCollection;
import org.locationtech.jts.geom.GeometryFactory;
import org.locationtech.jts.geom.MultiPolygon;
import org.locationtech.jts.geom.Polygon;
import org.locationtech.jts.geom.Polygonal;
import org.locationtech.jts.geom.TopologyException;
import org.locationtech.jts.geom.impl.PackedCoordinateSequenceFactory;
import org.locationtech.jts.operation.overlayng.OverlayNG;
import org.locationtech.jts.operation.overlayng.OverlayNGRobust;

/**
 * A collection of utilities for working with JTS polygons.
 */
public class GeoUtils {

  public static final GeometryFactory JTS_FACTORY = new GeometryFactory(PackedCoordinateSequenceFactory.DOUBLE_FACTORY);

  public static final Geometry EMPTY_GEOMETRY = JTS_FACTORY.createGeometryCollection();
  public static final Polygon EMPTY_POLYGON = JTS_FACTORY.createPolygon();
  private static final Polygon[] EMPTY_POLYGON_ARRAY = new Polygon[0];

  private GeoUtils() {}

  public static MultiPolygon createMultiPolygon(List<Polygon> polygons) {
    return JTS_FACTORY.createMultiPolygon(polygons.toArray(EMPTY_POLYGON_ARRAY));
  }

  /** Returns an empty polygon for no polygons, the polygon itself for one, or a multipolygon for more. */
  public static Geometry combinePolygons(List<Polygon> polys) {
    if (polys.isEmpty()) {
      return EMPTY_POLYGON;
    }
    return polys.size() == 1 ? polys.get(0) : createMultiPolygon(polys);
  }

  /** Returns true if {@code geom} is a polygon or multipolygon, including empty ones. */
  public static boolean isPolygonal(Geometry geom) {
    return geom instanceof Polygonal;
  }

  /** Returns every non-empty polygon in {@code geom}, descending into multipolygons and geometry collections. */
  public static List<Polygon> polygons(Geometry geom) {
    List<Polygon> result = new ArrayList<>();
    addPolygons(geom, result);
    return result;
  }

  private static void addPolygons(Geometry geom, List<Polygon> result) {
    if (geom instanceof Polygon polygon) {
      if (!polygon.isEmpty()) {
        result.add(polygon);
      }
    } else if (geom instanceof GeometryCollection collection) {
      for (int i = 0; i < collection.getNumGeometries(); i++) {
        addPolygons(collection.getGeometryN(i), result);
      }
    }
  }

  /**
   * Returns the polygonal part of {@code geom}: the geometry itself if it is already a polygon or multipolygon,
   * otherwise its polygons with any points and lines dropped.
   */
  public static Geometry polygonalParts(Geometry geom) {
    if (geom instanceof Polygonal) {
      return geom;
    }
    return combinePolygons(polygons(geom));
  }

  /**
   * Attempt to fix any self-intersections or overlaps in {@code geom}.
   *
   * @throws GeometryException if a robustness error occurred
   */
  public static Geometry fixPolygon(Geometry geom) throws GeometryException {
    try {
      return geom.buffer(0);
    } catch (TopologyException e) {
      throw new GeometryException("fix_polygon_topology_error", "robustness error fixing polygon: " + e, e);
    }
  }

  /**
   * More aggressive fix for self-intersections than {@link #fixPolygon(Geometry)} that expands then contracts the shape
   * by {@code buffer}.
   *
   * @throws GeometryException if a robustness error occurred
   */
  public static Geometry fixPolygon(Geometry geom, double buffer) throws GeometryException {
    try {
      return geom.buffer(buffer).buffer(-buffer);
    } catch (TopologyException e) {
      throw new GeometryException("fix_polygon_buffer_topology_error", "robustness error fixing polygon: " + e, e);
    }
  }

  /**
   * Returns the part of {@code a} that is not covered by {@code b}.
   *
   * @throws GeometryException if the overlay fails even with snapping fallbacks
   */
  public static Geometry difference(Geometry a, Geometry b) throws GeometryException {
    try {
      return OverlayNGRobust.overlay(a, b, OverlayNG.DIFFERENCE);
    } catch (TopologyException e) {
      throw new GeometryException("difference_topology_error", "robustness error computing difference: " + e, e);
    }
  }

  /**
   * Returns the area covered by both {@code a} and {@code b}.
   *
   * @throws GeometryException if the overlay fails even with snapping fallbacks
   */
  public static Geometry intersection(Geometry a, Geometry b) throws GeometryException {
    try {
      return OverlayNGRobust.overlay(a, b, OverlayNG.INTERSECTION);
    } catch (TopologyException e) {
      throw new GeometryException("intersection_topology_error", "robustness error computing intersection: " + e, e);
    }
  }

  /**
   * Returns the area covered by any of {@code geometries}.
   *
   * @throws GeometryException if the union fails even with snapping fallbacks
   */
  public static Geometry union(Collection<Geometry> geometries) throws GeometryException {
    if (geometries.isEmpty()) {
      return EMPTY_POLYGON;
    } else if (geometries.size() == 1) {
      return geometries.iterator().next();
    }
    try {
      return OverlayNGRobust.union(geometries);
    } catch (TopologyException e) {
      throw new GeometryException("union_topology_error", "robustness error computing union: " + e, e);
    }
  }
}
