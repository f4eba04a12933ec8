package com.onthegomap.overlapresolver.geo;

import static com.onthegomap.overlapresolver.TestUtils.*;
import static org.junit.jupiter.api.Assertions.*;

import com.onthegomap.overlapresolver.stats.Stats;
import org.junit.jupiter.api.Test;
import org.locationtech.jts.geom.Geometry;
import org.locationtech.jts.geom.Polygonal;

class GeometryRepairTest {

  private final Stats stats = Stats.inMemory();
  private final GeometryRepair repair = new GeometryRepair(1e-9, 1e-7, stats);

  @Test
  void testValidGeometryIsReturnedAsIs() throws GeometryException {
    var input = rectangle(0, 1);
    assertSame(input, repair.repair(input));
    assertTrue(stats.dataErrors().isEmpty());
  }

  @Test
  void testNullAndEmpty() throws GeometryException {
    assertTrue(repair.repair(null).isEmpty());
    assertTrue(repair.repair(GeoUtils.EMPTY_GEOMETRY).isEmpty());
    assertInstanceOf(Polygonal.class, repair.repair(GeoUtils.EMPTY_GEOMETRY));
  }

  @Test
  void testFixSelfIntersection() throws GeometryException {
    Geometry result = repair.repair(bowTie());
    assertTrue(result.isValid());
    assertInstanceOf(Polygonal.class, result);
    assertEquals(0.5, result.getArea(), 1e-9);
    assertEquals(1L, stats.dataErrors().get("repair_fixer"));
  }

  @Test
  void testSelfIntersectionKeepsBothLobes() throws GeometryException {
    Geometry result = repair.repair(bowTie());
    assertFalse(result.isEmpty());
    assertEquals(2, result.getNumGeometries());
    assertTrue(result.contains(newPoint(0.1, 0.5)));
    assertTrue(result.contains(newPoint(0.9, 0.5)));
    assertSameArea(newMultiPolygon(
      newPolygon(0, 0, 0.5, 0.5, 0, 1, 0, 0),
      newPolygon(1, 0, 1, 1, 0.5, 0.5, 1, 0)
    ), result);
  }

  @Test
  void testCollapsedRingRepairsToEmpty() throws GeometryException {
    var collapsed = newPolygon(0, 0, 1, 0, 2, 0, 0, 0);
    assertFalse(collapsed.isValid());
    assertTrue(repair.repair(collapsed).isEmpty());
  }

  @Test
  void testRemoveSliver() throws GeometryException {
    var sliver = rectangle(5, 5, 5.00001, 5.00001);
    Geometry result = repair.repair(newMultiPolygon(rectangle(0, 1), sliver));
    assertSameNormalizedGeometry(rectangle(0, 1), result);
    assertEquals(1L, stats.dataErrors().get("repair_cleanup"));
  }

  @Test
  void testKeepSmallPartsWithZeroEpsilon() throws GeometryException {
    var noEpsilon = new GeometryRepair(0, 1e-7, stats);
    var input = newMultiPolygon(rectangle(0, 1), rectangle(5, 5, 5.00001, 5.00001));
    assertSame(input, noEpsilon.repair(input));
  }

  @Test
  void testOnlySliversLeavesEmptyPolygon() throws GeometryException {
    Geometry result = repair.repair(rectangle(5, 5, 5.00001, 5.00001));
    assertTrue(result.isEmpty());
    assertInstanceOf(Polygonal.class, result);
  }

  @Test
  void testDropNonPolygonalParts() throws GeometryException {
    Geometry result = repair.repair(newGeometryCollection(
      rectangle(0, 1),
      newLineString(2, 2, 3, 3),
      newPoint(5, 5)
    ));
    assertSameNormalizedGeometry(rectangle(0, 1), result);
  }

  @Test
  void testLineOnlyBecomesEmpty() throws GeometryException {
    assertTrue(repair.repair(newLineString(0, 0, 1, 1)).isEmpty());
  }

  @Test
  void testIdempotent() throws GeometryException {
    for (Geometry input : new Geometry[]{
      bowTie(),
      rectangle(0, 1),
      newMultiPolygon(rectangle(0, 1), rectangle(5, 5, 5.00001, 5.00001)),
      newGeometryCollection(rectangle(0, 1), newPoint(5, 5)),
      // overlapping parts of a multipolygon
      newMultiPolygon(rectangle(0, 2), rectangle(1, 3))
    }) {
      Geometry once = repair.repair(input);
      assertSame(once, repair.repair(once), input::toString);
      assertTrue(repair.isClean(once), input::toString);
    }
  }

  @Test
  void testOverlappingMultipolygonParts() throws GeometryException {
    Geometry result = repair.repair(newMultiPolygon(rectangle(0, 2), rectangle(1, 3)));
    assertTrue(result.isValid());
    assertSameArea(rectangle(0, 2).union(rectangle(1, 3)), result);
  }

  @Test
  void testRepairFailure() {
    var failing = new GeometryRepair(1e-9, 1e-7, stats) {
      @Override
      public boolean isClean(Geometry geometry) {
        return false;
      }
    };
    var e = assertThrows(GeometryException.class, () -> failing.repair(rectangle(0, 1)));
    assertEquals("repair_failed", e.stat());
    assertTrue(e.detailedMessage().contains("input (wkt): POLYGON"), e.detailedMessage());
  }
}
